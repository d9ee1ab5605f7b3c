package com.asmblr.dag.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.asmblr.dag.value.EncodedValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat wire representation of a graph: node records plus edge records.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphRecord {
    private List<NodeRecord> nodes = new ArrayList<>();
    private List<ConnectionRecord> connections = new ArrayList<>();

    /**
     * One node: its id, its registered type name and the encoded direct values of
     * its unconnected input sockets.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeRecord {
        private String id;
        private String name;
        private Map<String, EncodedValue> data = new LinkedHashMap<>();
    }

    /** One edge, from {@code source.sourceOutput} to {@code target.targetInput}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionRecord {
        private String source;
        private String sourceOutput;
        private String target;
        private String targetInput;
    }
}
