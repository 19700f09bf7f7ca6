package com.dfisemesh.mesh;

import com.dfisemesh.dfise.Diagnostic;

import java.util.List;

public record Reconstruction(List<ReconstructedFace> faces,
                             List<ReconstructedElement> elements,
                             List<Diagnostic> issues) {
    public Reconstruction {
        faces = List.copyOf(faces);
        elements = List.copyOf(elements);
        issues = List.copyOf(issues);
    }
}
