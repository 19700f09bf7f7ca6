package com.dfisemesh.dfise;

public class DfiseParseException extends RuntimeException {
    private final Diagnostic diagnostic;

    public DfiseParseException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public ErrorKind kind() {
        return diagnostic.kind();
    }
}
