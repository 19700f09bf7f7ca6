package com.dfisemesh.dfise;

import java.util.List;

public record Decoded<T>(T value, List<Diagnostic> issues) {
    public Decoded {
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
