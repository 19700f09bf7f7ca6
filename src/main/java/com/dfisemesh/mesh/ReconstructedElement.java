package com.dfisemesh.mesh;

import java.util.List;

/**
 * Tetrahedron resolved to four vertices in ascending index order, not in winding order.
 * {@code degraded} marks an element whose faces did not span exactly four vertices.
 */
public record ReconstructedElement(int index, List<Integer> vertices, boolean degraded) {
    public ReconstructedElement {
        vertices = List.copyOf(vertices);
    }
}
