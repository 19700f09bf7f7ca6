package com.dfisemesh.dfise;

/**
 * Reference into a lower-level table with its traversal direction.
 * <p>
 * On disk a reference {@code k >= 0} means "entry k as stored" and {@code -(k + 1)} means "entry k reversed".
 * The sign is decoded once here; nothing downstream looks at raw signed integers.
 */
public record SignedRef(int index, Orientation orientation) {

    public SignedRef {
        if (index < 0) {
            throw new IllegalArgumentException("Reference index must be non-negative: " + index);
        }
    }

    public static SignedRef decode(int raw) {
        return raw < 0
                ? new SignedRef(-raw - 1, Orientation.REVERSED)
                : new SignedRef(raw, Orientation.FORWARD);
    }
}
