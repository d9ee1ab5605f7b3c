package com.asmblr.dag.error;

/**
 * Base class for every failure raised by the graph core.
 *
 * <p>
 * Carries the node id, node type and socket name involved when they are known,
 * so callers can report the offending part of the graph instead of a bare stack
 * trace. Any of the three may be {@code null}.
 */
public class GraphException extends RuntimeException {
    private final String nodeId;
    private final String nodeType;
    private final String socketName;

    public GraphException(String message, String nodeId, String nodeType, String socketName) {
        this(message, nodeId, nodeType, socketName, null);
    }

    public GraphException(String message, String nodeId, String nodeType, String socketName, Throwable cause) {
        super(decorate(message, nodeId, nodeType, socketName), cause);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.socketName = socketName;
    }

    public String nodeId() {
        return nodeId;
    }

    public String nodeType() {
        return nodeType;
    }

    public String socketName() {
        return socketName;
    }

    private static String decorate(String message, String nodeId, String nodeType, String socketName) {
        if (nodeId == null && nodeType == null && socketName == null)
            return message;
        StringBuilder sb = new StringBuilder(message).append(" [");
        boolean first = true;
        if (nodeType != null) {
            sb.append("type=").append(nodeType);
            first = false;
        }
        if (nodeId != null) {
            sb.append(first ? "" : ", ").append("node=").append(nodeId);
            first = false;
        }
        if (socketName != null)
            sb.append(first ? "" : ", ").append("socket=").append(socketName);
        return sb.append(']').toString();
    }
}
