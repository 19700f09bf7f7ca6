package com.dfisemesh.mesh;

import java.util.List;

public record ReconstructedFace(int index, List<Integer> vertices, boolean degraded) {
    public ReconstructedFace {
        vertices = List.copyOf(vertices);
    }
}
