package com.dfisemesh.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Path;

public final class MeshJson {
    private MeshJson() {
    }

    public static ObjectMapper statsMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void writeStats(StatsDocument document, Path output) throws IOException {
        statsMapper().writeValue(output.toFile(), document);
    }

    public static MaterialLibraryDocument readMaterials(Path input) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper.readValue(input.toFile(), MaterialLibraryDocument.class);
    }
}
