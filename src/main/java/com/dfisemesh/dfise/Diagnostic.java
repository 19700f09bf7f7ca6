package com.dfisemesh.dfise;

public record Diagnostic(Severity severity, ErrorKind kind, int line, String message) {

    public static Diagnostic warning(ErrorKind kind, int line, String message) {
        return new Diagnostic(Severity.WARNING, kind, line, message);
    }

    public static Diagnostic error(ErrorKind kind, int line, String message) {
        return new Diagnostic(Severity.ERROR, kind, line, message);
    }

    public static Diagnostic error(ErrorKind kind, String message) {
        return error(kind, 0, message);
    }

    public Diagnostic asError() {
        return severity == Severity.ERROR ? this : new Diagnostic(Severity.ERROR, kind, line, message);
    }

    @Override
    public String toString() {
        return line > 0 ? "Line " + line + ": " + message : message;
    }
}
