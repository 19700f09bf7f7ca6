package com.dfisemesh.io;

import java.util.LinkedHashMap;
import java.util.Map;

public class MaterialLibraryDocument {
    public MaterialDto defaults;
    public Map<String, MaterialDto> materials = new LinkedHashMap<>();
}
