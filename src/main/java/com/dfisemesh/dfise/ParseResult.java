package com.dfisemesh.dfise;

import java.util.List;

/**
 * Value produced by a parse pass with the warnings and errors accumulated on the way.
 * The value is {@code null} when the pass could not produce anything usable.
 */
public record ParseResult<T>(ParseStatus status, T value, List<Diagnostic> warnings, List<Diagnostic> errors) {

    public ParseResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public static <T> ParseResult<T> of(T value, List<Diagnostic> warnings, List<Diagnostic> errors) {
        ParseStatus status;
        if (value == null || !errors.isEmpty()) {
            status = ParseStatus.FAILED;
        } else if (!warnings.isEmpty()) {
            status = ParseStatus.PARTIAL;
        } else {
            status = ParseStatus.SUCCESS;
        }
        return new ParseResult<>(status, value, warnings, errors);
    }

    public static <T> ParseResult<T> failed(List<Diagnostic> warnings, List<Diagnostic> errors) {
        return new ParseResult<>(ParseStatus.FAILED, null, warnings, errors);
    }

    public boolean hasValue() {
        return value != null;
    }

    public T orThrow() {
        if (value == null || status == ParseStatus.FAILED) {
            Diagnostic first = errors.isEmpty()
                    ? Diagnostic.error(ErrorKind.CORRUPTED_FILE, "Parse pass produced no value")
                    : errors.get(0);
            throw new DfiseParseException(first);
        }
        return value;
    }
}
