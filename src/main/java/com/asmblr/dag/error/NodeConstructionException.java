package com.asmblr.dag.error;

/**
 * Socket setup for a node failed: an invalid schema, a default value that could
 * not be applied, or a graph record that cannot be turned into a node.
 */
public class NodeConstructionException extends GraphException {

    public NodeConstructionException(String message, String nodeId, String nodeType) {
        super(message, nodeId, nodeType, null);
    }

    public NodeConstructionException(String message, String nodeId, String nodeType, Throwable cause) {
        super(message, nodeId, nodeType, null, cause);
    }
}
