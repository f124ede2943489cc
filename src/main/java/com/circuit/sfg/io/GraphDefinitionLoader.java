package com.circuit.sfg.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads JSON graph definitions with Jackson.
 *
 * <pre>
 * { "graph": { "name": "...", "start": "x1", "end": "x3",
 *     "nodes": [ { "id": "x1", "edges": [ { "to": "x2", "weight": "a" } ] } ] } }
 * </pre>
 */
public final class GraphDefinitionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphDefinitionLoader() {
        // Utility class
    }

    /** Parses a JSON file. */
    public static GraphDefinition load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return check(MAPPER.readValue(in, GraphDefinition.class), path.toString());
        } catch (IOException e) {
            throw new GraphDefinitionException("Failed to load graph definition from " + path, e);
        }
    }

    /** Parses a JSON string. */
    public static GraphDefinition parse(String json) {
        try {
            return check(MAPPER.readValue(json, GraphDefinition.class), "<string>");
        } catch (JsonProcessingException e) {
            throw new GraphDefinitionException("Malformed graph definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a classpath resource such as {@code graphs/chain.json}. */
    public static GraphDefinition loadResource(String resource) {
        InputStream in = GraphDefinitionLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new GraphDefinitionException("Resource not found: " + resource);
        try (in) {
            return check(MAPPER.readValue(in, GraphDefinition.class), resource);
        } catch (IOException e) {
            throw new GraphDefinitionException("Failed to load graph definition from " + resource, e);
        }
    }

    private static GraphDefinition check(GraphDefinition def, String origin) {
        if (def == null || def.getGraph() == null)
            throw new GraphDefinitionException("Missing 'graph' key in " + origin);
        return def;
    }
}
