package com.dfisemesh.dfise;

import java.util.List;

public record Face(List<SignedRef> edgeRefs) {
    public static final int TYPE_TAG = 3;
    public static final int EDGE_COUNT = 3;

    public Face {
        edgeRefs = List.copyOf(edgeRefs);
    }
}
