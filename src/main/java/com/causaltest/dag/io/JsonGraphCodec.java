package com.causaltest.dag.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@link GraphDefinition}s as JSON.
 *
 * <pre>
 * {
 *   "name" : "vaccine",
 *   "nodes" : [ { "name" : "Age" }, { "name" : "Vaccine" } ],
 *   "edges" : [ { "source" : "Age", "target" : "Vaccine" } ]
 * }
 * </pre>
 *
 * Edges may name nodes that are not listed under {@code nodes}.
 */
public final class JsonGraphCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonGraphCodec() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if the text is not a well-formed
     *                                  definition.
     */
    public static GraphDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, GraphDefinition.class).validate();
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    /**
     * @throws IllegalArgumentException if the file is not a well-formed
     *                                  definition.
     * @throws IOException              if the file cannot be read.
     */
    public static GraphDefinition parseFile(Path path) throws IOException {
        try {
            return MAPPER.readValue(path.toFile(), GraphDefinition.class).validate();
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    private static IllegalArgumentException malformed(JsonProcessingException e) {
        return new IllegalArgumentException("Malformed graph definition: " + e.getOriginalMessage(), e);
    }

    public static String write(GraphDefinition def) {
        try {
            return MAPPER.writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void writeFile(GraphDefinition def, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), def);
    }
}
