package com.dfisemesh.dfise;

public enum ErrorKind {
    CORRUPTED_FILE,
    MISSING_SECTION,
    DATA_INCONSISTENCY
}
