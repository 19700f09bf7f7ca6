package com.dfisemesh.nastran;

import java.util.List;

public record BulkDeck(List<String> lines, ExportSummary summary) {
    public BulkDeck {
        lines = List.copyOf(lines);
    }
}
