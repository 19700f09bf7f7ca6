package com.dfisemesh.io;

public class MaterialDto {
    public double youngsModulus;
    public double poissonRatio;
    public double density;
}
