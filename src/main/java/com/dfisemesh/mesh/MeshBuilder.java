package com.dfisemesh.mesh;

import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.region.RegionIndex;

import java.util.List;

public final class MeshBuilder {
    private MeshBuilder() {
    }

    public static ReconstructedMesh fromDocument(DfiseDocument document, ReconstructionConfig config) {
        Reconstruction reconstruction = new ConnectivityReconstructor(config).reconstruct(
                document.vertices().size(),
                document.edges(),
                document.faces(),
                document.elements()
        );
        FaceAdjacency adjacency = FaceAdjacency.build(document.faces().size(), document.elements());
        RegionIndex regionIndex = RegionIndex.build(document.regions(), document.info().nbElements());
        List<BoundaryFace> boundaryFaces = BoundaryClassifier.classify(document.locations(), adjacency, regionIndex);

        return new ReconstructedMesh(
                document,
                reconstruction.faces(),
                reconstruction.elements(),
                adjacency,
                regionIndex,
                boundaryFaces,
                reconstruction.issues()
        );
    }
}
