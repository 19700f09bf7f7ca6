package com.dfisemesh.dfise;

import java.util.List;

public record Region(String name, String material, int declaredElementCount, List<Integer> elementIndices) {
    public Region {
        elementIndices = List.copyOf(elementIndices);
    }
}
