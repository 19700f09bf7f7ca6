package com.dfisemesh.validation;

import com.dfisemesh.dfise.InfoBlock;
import com.dfisemesh.dfise.LocationCode;

import java.util.List;

public record MeshStatistics(
        int eulerCharacteristic,
        double edgesPerVertex,
        double facesPerVertex,
        double elementsPerVertex,
        double facesPerEdge,
        double elementsPerFace,
        int boundaryEdges,
        int interiorFaces,
        int interfaceFaces,
        int exteriorFaces
) {
    public static MeshStatistics compute(InfoBlock info, List<LocationCode> locations) {
        int v = info.nbVertices();
        int e = info.nbEdges();
        int f = info.nbFaces();
        int c = info.nbElements();

        int interior = 0;
        int interfaces = 0;
        int exterior = 0;
        for (LocationCode code : locations) {
            switch (code) {
                case INTERIOR -> interior++;
                case INTERFACE -> interfaces++;
                case EXTERIOR -> exterior++;
            }
        }

        return new MeshStatistics(
                ConsistencyValidator.eulerCharacteristic(info),
                ratio(2.0 * e, v),
                ratio(f, v),
                ratio(4.0 * c, v),
                ratio(f, e),
                ratio(c, f),
                3 * f - 2 * e,
                interior,
                interfaces,
                exterior
        );
    }

    private static double ratio(double numerator, int denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
