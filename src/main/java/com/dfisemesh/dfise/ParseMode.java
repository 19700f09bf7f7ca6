package com.dfisemesh.dfise;

public enum ParseMode {
    LENIENT,
    STRICT;

    public boolean isStrict() {
        return this == STRICT;
    }
}
