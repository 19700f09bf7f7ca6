package com.dfisemesh.dfise;

import java.util.Optional;

public enum LocationCode {
    INTERIOR('i'),
    INTERFACE('f'),
    EXTERIOR('e');

    private final char code;

    LocationCode(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static Optional<LocationCode> fromCode(char c) {
        for (LocationCode value : values()) {
            if (value.code == c) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
