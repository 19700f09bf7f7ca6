package com.dfisemesh.nastran;

public record MaterialProperties(double youngsModulus, double poissonRatio, double density) {
    public static final MaterialProperties DEFAULT = new MaterialProperties(2.1e11, 0.3, 0.0);
    public static final MaterialProperties SILICON = new MaterialProperties(170e9, 0.28, 2329.0);
}
