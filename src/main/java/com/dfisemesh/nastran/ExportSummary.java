package com.dfisemesh.nastran;

public record ExportSummary(
        int nodes,
        int materials,
        int properties,
        int parsedElements,
        int exportedElements,
        int surfaceElements,
        boolean surfacesSkipped
) {
    public int omittedElements() {
        return parsedElements - exportedElements;
    }

    public boolean hasOmissions() {
        return omittedElements() > 0;
    }
}
