package com.dfisemesh.io;

import java.util.ArrayList;
import java.util.List;

public class InfoDto {
    public String version;
    public String type;
    public int dimension;
    public int nbVertices;
    public int nbEdges;
    public int nbFaces;
    public int nbElements;
    public int nbRegions;
    public List<String> regions = new ArrayList<>();
    public List<String> materials = new ArrayList<>();
}
