package com.dfisemesh.mesh;

import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.Diagnostic;
import com.dfisemesh.dfise.LocationCode;
import com.dfisemesh.dfise.Vertex;
import com.dfisemesh.region.RegionIndex;
import com.dfisemesh.region.RegionSummary;

import java.util.List;
import java.util.Map;

public record ReconstructedMesh(DfiseDocument document,
                               List<ReconstructedFace> faces,
                               List<ReconstructedElement> elements,
                               FaceAdjacency adjacency,
                               RegionIndex regionIndex,
                               List<BoundaryFace> boundaryFaces,
                               List<Diagnostic> issues) {

    public ReconstructedMesh {
        faces = List.copyOf(faces);
        elements = List.copyOf(elements);
        boundaryFaces = List.copyOf(boundaryFaces);
        issues = List.copyOf(issues);
    }

    public List<Vertex> vertices() {
        return document.vertices();
    }

    public double[][] vertexCoordinates() {
        List<Vertex> vertices = document.vertices();
        double[][] out = new double[vertices.size()][];
        for (int i = 0; i < out.length; i++) {
            Vertex v = vertices.get(i);
            out[i] = new double[]{v.x(), v.y(), v.z()};
        }
        return out;
    }

    public int[][] elementVertexIds() {
        int[][] out = new int[elements.size()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = elements.get(i).vertices().stream().mapToInt(Integer::intValue).toArray();
        }
        return out;
    }

    public int[][] faceVertexIds() {
        int[][] out = new int[faces.size()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = faces.get(i).vertices().stream().mapToInt(Integer::intValue).toArray();
        }
        return out;
    }

    public List<LocationCode> locations() {
        return document.locations();
    }

    public Map<Integer, String> elementRegions() {
        return regionIndex.elementRegions();
    }

    public Map<String, RegionSummary> regions() {
        return regionIndex.summaries();
    }
}
