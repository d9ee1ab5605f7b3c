package com.asmblr.dag.error;

/** Raised when a node type name has no registered factory. */
public class UnknownNodeTypeException extends GraphException {

    public UnknownNodeTypeException(String typeName) {
        super("No node factory registered for type '" + typeName + "'", null, typeName, null);
    }

    public UnknownNodeTypeException(String typeName, String nodeId) {
        super("No node factory registered for type '" + typeName + "'", nodeId, typeName, null);
    }
}
