package com.dfisemesh.mesh;

import com.dfisemesh.dfise.LocationCode;
import com.dfisemesh.region.RegionIndex;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class BoundaryClassifier {
    private BoundaryClassifier() {
    }

    public static List<BoundaryFace> classify(List<LocationCode> locations,
                                              FaceAdjacency adjacency,
                                              RegionIndex regions) {
        List<BoundaryFace> out = new ArrayList<>(adjacency.faceCount());
        for (int face = 0; face < adjacency.faceCount(); face++) {
            out.add(classifyFace(face, face < locations.size() ? locations.get(face) : null,
                    adjacency.elementsOf(face), regions));
        }
        return out;
    }

    static BoundaryFace classifyFace(int face, LocationCode location, List<Integer> elements, RegionIndex regions) {
        if (location == null) {
            return new BoundaryFace(face, BoundaryKind.UNCLASSIFIED, null, null, null);
        }
        if (location == LocationCode.EXTERIOR && elements.size() == 1) {
            String region = regions.regionOf(elements.get(0)).orElse(null);
            return new BoundaryFace(face, BoundaryKind.EXTERIOR, region, null,
                    materialPair(regions, region, null));
        }
        if (location == LocationCode.INTERFACE && elements.size() == 2) {
            int a = Math.min(elements.get(0), elements.get(1));
            int b = Math.max(elements.get(0), elements.get(1));
            String regionA = regions.regionOf(a).orElse(null);
            String regionB = regions.regionOf(b).orElse(null);
            return new BoundaryFace(face, BoundaryKind.INTERFACE, regionA, regionB,
                    materialPair(regions, regionA, regionB));
        }
        if (location == LocationCode.INTERIOR && elements.size() == 2) {
            return new BoundaryFace(face, BoundaryKind.INTERIOR, null, null, null);
        }
        return new BoundaryFace(face, BoundaryKind.INCONSISTENT, null, null, null);
    }

    public static Map<BoundaryKind, Integer> countByKind(List<BoundaryFace> faces) {
        Map<BoundaryKind, Integer> counts = new EnumMap<>(BoundaryKind.class);
        for (BoundaryKind kind : BoundaryKind.values()) {
            counts.put(kind, 0);
        }
        for (BoundaryFace face : faces) {
            counts.merge(face.kind(), 1, Integer::sum);
        }
        return counts;
    }

    // "Oxide|Silicon": sorted, blanks dropped
    private static String materialPair(RegionIndex regions, String regionA, String regionB) {
        String pair = Stream.of(regionA, regionB)
                .map(r -> regions.materialOfRegion(r).orElse(""))
                .filter(m -> !m.isEmpty())
                .sorted()
                .collect(Collectors.joining("|"));
        return pair.isEmpty() ? null : pair;
    }
}
