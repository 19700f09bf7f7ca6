package com.dfisemesh.dfise;

public enum Orientation {
    FORWARD,
    REVERSED
}
