package com.dfisemesh.dfise;

import java.util.List;

final class Issues {
    private Issues() {
    }

    static void warn(List<Diagnostic> sink, ParseMode mode, ErrorKind kind, int line, String message) {
        Diagnostic diagnostic = Diagnostic.warning(kind, line, message);
        if (mode.isStrict()) {
            throw new DfiseParseException(diagnostic.asError());
        }
        sink.add(diagnostic);
    }
}
