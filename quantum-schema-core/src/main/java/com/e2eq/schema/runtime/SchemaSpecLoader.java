package com.e2eq.schema.runtime;

import com.e2eq.schema.core.SchemaSpec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds schema definitions from YAML: a top-level mapping of schema name to definition.
 * Declaration order is preserved.
 */
public final class SchemaSpecLoader {

    private static final TypeReference<LinkedHashMap<String, SchemaSpec>> SPECS = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public Map<String, SchemaSpec> loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public Map<String, SchemaSpec> loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public Map<String, SchemaSpec> load(InputStream in) throws IOException {
        LinkedHashMap<String, SchemaSpec> specs = mapper.readValue(in, SPECS);
        return specs == null ? new LinkedHashMap<>() : specs;
    }
}
