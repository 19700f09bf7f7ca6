package com.dfisemesh.dfise;

import java.util.List;
import java.util.Map;

public record DfiseDocument(
        InfoBlock info,
        CoordSystem coordSystem,
        List<Vertex> vertices,
        List<Edge> edges,
        List<Face> faces,
        List<Element> elements,
        List<LocationCode> locations,
        List<Region> regions,
        Map<Integer, Integer> faceTypeCounts,
        Map<Integer, Integer> elementTypeCounts
) {
    public DfiseDocument {
        vertices = List.copyOf(vertices);
        edges = List.copyOf(edges);
        faces = List.copyOf(faces);
        elements = List.copyOf(elements);
        locations = List.copyOf(locations);
        regions = List.copyOf(regions);
        faceTypeCounts = Map.copyOf(faceTypeCounts);
        elementTypeCounts = Map.copyOf(elementTypeCounts);
    }
}
