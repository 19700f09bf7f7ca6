package com.dfisemesh.dfise;

import java.util.List;

public record Element(List<SignedRef> faceRefs) {
    public static final int TYPE_TAG = 5;
    public static final int FACE_COUNT = 4;

    public Element {
        faceRefs = List.copyOf(faceRefs);
    }
}
