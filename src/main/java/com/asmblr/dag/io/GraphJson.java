package com.asmblr.dag.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

import com.asmblr.dag.api.Node;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON text front end for {@link GraphCodec}.
 *
 * <p>
 * Writes {@code {"nodes": [...], "connections": [...]}}, optionally nested under
 * a wrapper key. On read, a document whose top level is a single key other than
 * {@code nodes} is unwrapped first.
 */
public final class GraphJson {
    private static final String NODES = "nodes";

    private final GraphCodec codec;
    private final ObjectMapper mapper;

    public GraphJson(GraphCodec codec) {
        this(codec, true);
    }

    public GraphJson(GraphCodec codec, boolean pretty) {
        this.codec = codec;
        // non-finite numbers travel as bare NaN / Infinity tokens, not strings
        this.mapper = JsonMapper.builder()
                .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, pretty)
                .build();
    }

    public GraphCodec codec() {
        return codec;
    }

    /** Serializes the graph upstream of {@code root}. */
    public String toJson(Node root) {
        return toJson(root, null);
    }

    /** Serializes the graph upstream of {@code root} under {@code wrapper}, if not null. */
    public String toJson(Node root, String wrapper) {
        GraphRecord record = codec.serialize(root);
        try {
            if (wrapper == null)
                return mapper.writeValueAsString(record);
            ObjectNode doc = mapper.createObjectNode();
            doc.set(wrapper, mapper.valueToTree(record));
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write graph JSON", e);
        }
    }

    /** Writes {@link #toJson(Node)} to a file. */
    public void write(Node root, Path path) throws IOException {
        Files.writeString(path, toJson(root));
    }

    /** Parses and rebuilds a graph from JSON text. */
    public LoadedGraph fromJson(String json) {
        return codec.deserialize(readRecord(json));
    }

    /** Parses and rebuilds a graph from a JSON file. */
    public LoadedGraph fromJson(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    /**
     * Parses JSON text into a {@link GraphRecord} without building nodes.
     *
     * @throws IllegalArgumentException if the text is not JSON or has no
     *                                  {@code nodes} array.
     */
    public GraphRecord readRecord(String json) {
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject())
            throw new IllegalArgumentException("Graph JSON must be an object");

        if (!tree.has(NODES) && tree.size() == 1) {
            Iterator<Map.Entry<String, JsonNode>> it = tree.fields();
            tree = it.next().getValue();
        }
        if (tree == null || !tree.isObject() || !tree.has(NODES))
            throw new IllegalArgumentException("Missing '" + NODES + "' key");
        if (!tree.get(NODES).isArray())
            throw new IllegalArgumentException("'" + NODES + "' must be an array");

        try {
            return mapper.treeToValue(tree, GraphRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph record: " + e.getOriginalMessage(), e);
        }
    }
}
