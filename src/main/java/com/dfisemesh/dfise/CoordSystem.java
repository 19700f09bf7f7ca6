package com.dfisemesh.dfise;

import java.util.List;

public record CoordSystem(List<Double> translate, List<List<Double>> transform) {
    public CoordSystem {
        translate = List.copyOf(translate);
        transform = transform.stream().map(List::copyOf).toList();
    }
}
