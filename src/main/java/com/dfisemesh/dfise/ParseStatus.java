package com.dfisemesh.dfise;

public enum ParseStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
