package com.dfisemesh.nastran;

import com.dfisemesh.io.MaterialDto;
import com.dfisemesh.io.MaterialLibraryDocument;

import java.util.LinkedHashMap;
import java.util.Map;

public record MaterialLibrary(MaterialProperties defaults, Map<String, MaterialProperties> overrides) {
    public MaterialLibrary {
        overrides = Map.copyOf(overrides);
    }

    public static MaterialLibrary uniform(MaterialProperties properties) {
        return new MaterialLibrary(properties, Map.of());
    }

    public static MaterialLibrary fromDocument(MaterialLibraryDocument document, MaterialProperties fallback) {
        MaterialProperties defaults = document.defaults == null ? fallback : toProperties(document.defaults);
        Map<String, MaterialProperties> overrides = new LinkedHashMap<>();
        if (document.materials != null) {
            for (Map.Entry<String, MaterialDto> entry : document.materials.entrySet()) {
                if (entry.getValue() == null) {
                    throw new IllegalArgumentException("Material entry has no properties: " + entry.getKey());
                }
                overrides.put(entry.getKey(), toProperties(entry.getValue()));
            }
        }
        return new MaterialLibrary(defaults, overrides);
    }

    public MaterialProperties propertiesFor(String material) {
        return overrides.getOrDefault(material, defaults);
    }

    private static MaterialProperties toProperties(MaterialDto dto) {
        return new MaterialProperties(dto.youngsModulus, dto.poissonRatio, dto.density);
    }
}
