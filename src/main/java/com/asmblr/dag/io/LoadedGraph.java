package com.asmblr.dag.io;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.asmblr.dag.api.Node;

/**
 * The result of rebuilding a graph from its wire form.
 *
 * @param roots              nodes with no outbound connections, in record
 *                           order.
 * @param nodesById          every rebuilt node, in record order.
 * @param skippedConnections edge records that could not be rebuilt.
 */
public record LoadedGraph(List<Node> roots, Map<String, Node> nodesById,
        List<GraphRecord.ConnectionRecord> skippedConnections) {

    public LoadedGraph {
        roots = List.copyOf(roots);
        nodesById = Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
        skippedConnections = List.copyOf(skippedConnections);
    }

    /** True when the graph has exactly one sink. */
    public boolean hasSingleRoot() {
        return roots.size() == 1;
    }

    /**
     * The single root.
     *
     * @throws IllegalStateException if the graph has zero or several roots; use
     *                               {@link #roots()} then.
     */
    public Node root() {
        if (roots.size() != 1)
            throw new IllegalStateException("Graph has " + roots.size() + " roots, not exactly one");
        return roots.get(0);
    }

    public Node node(String id) {
        return nodesById.get(id);
    }
}
