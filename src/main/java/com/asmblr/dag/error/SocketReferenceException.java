package com.asmblr.dag.error;

/**
 * A connection or a value assignment named a socket that does not exist on the
 * node. Fatal to the call that raised it; nothing is registered.
 */
public class SocketReferenceException extends GraphException {

    public SocketReferenceException(String message, String nodeId, String nodeType, String socketName) {
        super(message, nodeId, nodeType, socketName);
    }
}
