package com.dfisemesh.mesh;

public record BoundaryFace(int faceIndex,
                           BoundaryKind kind,
                           String regionA,
                           String regionB,
                           String materialPair) {
}
