package com.dfisemesh.io;

public class RegionDto {
    public String name;
    public String material;
    public int elementCount;
    public double fraction;
}
