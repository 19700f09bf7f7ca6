package com.dfisemesh.mesh;

import com.dfisemesh.dfise.Element;
import com.dfisemesh.dfise.SignedRef;

import java.util.ArrayList;
import java.util.List;

public final class FaceAdjacency {
    private final List<List<Integer>> elementsByFace;

    private FaceAdjacency(List<List<Integer>> elementsByFace) {
        this.elementsByFace = elementsByFace;
    }

    public static FaceAdjacency build(int faceCount, List<Element> elements) {
        List<List<Integer>> byFace = new ArrayList<>(faceCount);
        for (int i = 0; i < faceCount; i++) {
            byFace.add(new ArrayList<>(2));
        }
        for (int e = 0; e < elements.size(); e++) {
            for (SignedRef ref : elements.get(e).faceRefs()) {
                if (ref.index() < faceCount) {
                    byFace.get(ref.index()).add(e);
                }
            }
        }
        List<List<Integer>> frozen = new ArrayList<>(faceCount);
        for (List<Integer> list : byFace) {
            frozen.add(List.copyOf(list));
        }
        return new FaceAdjacency(List.copyOf(frozen));
    }

    public List<Integer> elementsOf(int face) {
        return face >= 0 && face < elementsByFace.size() ? elementsByFace.get(face) : List.of();
    }

    public int faceCount() {
        return elementsByFace.size();
    }
}
