package com.dfisemesh.mesh;

public enum BoundaryKind {
    EXTERIOR,
    INTERFACE,
    INTERIOR,
    INCONSISTENT,
    UNCLASSIFIED
}
