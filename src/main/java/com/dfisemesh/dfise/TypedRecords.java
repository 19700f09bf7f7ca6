package com.dfisemesh.dfise;

import java.util.List;
import java.util.Map;

public record TypedRecords<T>(List<T> records, Map<Integer, Integer> typeCounts) {
    public TypedRecords {
        records = List.copyOf(records);
        typeCounts = Map.copyOf(typeCounts);
    }
}
