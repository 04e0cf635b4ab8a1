package com.geostat.anamorphosis.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@link AnamorphosisDefinition} documents.
 */
public final class DefinitionLoader {
    public static final String DEFAULTS_RESOURCE = "anamorphosis-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private DefinitionLoader() {
        // Utility class
    }

    /** Parses a JSON file. */
    public static AnamorphosisDefinition parseFile(Path path) {
        try {
            return MAPPER.readValue(path.toFile(), AnamorphosisDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load anamorphosis definition from " + path, e);
        }
    }

    /** Parses a JSON string. */
    public static AnamorphosisDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, AnamorphosisDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse anamorphosis definition", e);
        }
    }

    /** Loads the bundled defaults. */
    public static AnamorphosisDefinition defaults() {
        try (InputStream in = DefinitionLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            return MAPPER.readValue(in, AnamorphosisDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Deep copy of a settings section. */
    public static AnamorphosisDefinition.Settings copy(AnamorphosisDefinition.Settings settings) {
        return MAPPER.convertValue(settings, AnamorphosisDefinition.Settings.class);
    }

    /** Serializes a definition. */
    public static String toJson(AnamorphosisDefinition def) {
        try {
            return MAPPER.writeValueAsString(def);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize anamorphosis definition", e);
        }
    }
}
