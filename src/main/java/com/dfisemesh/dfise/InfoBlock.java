package com.dfisemesh.dfise;

import java.util.List;

public record InfoBlock(
        String version,
        String type,
        int dimension,
        int nbVertices,
        int nbEdges,
        int nbFaces,
        int nbElements,
        int nbRegions,
        List<String> regions,
        List<String> materials
) {
    public InfoBlock {
        regions = List.copyOf(regions);
        materials = List.copyOf(materials);
    }
}
