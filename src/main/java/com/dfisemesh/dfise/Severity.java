package com.dfisemesh.dfise;

public enum Severity {
    WARNING,
    ERROR
}
