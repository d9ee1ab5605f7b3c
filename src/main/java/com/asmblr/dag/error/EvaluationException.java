package com.asmblr.dag.error;

/**
 * Expression construction failed while evaluating a node.
 *
 * <p>
 * Always attributed to the node that failed. The socket name, when present, is
 * the parameter the expression builder rejected.
 */
public class EvaluationException extends GraphException {

    public EvaluationException(String message, String nodeId, String nodeType, String parameter) {
        super(message, nodeId, nodeType, parameter);
    }

    public EvaluationException(String message, String nodeId, String nodeType, String parameter, Throwable cause) {
        super(message, nodeId, nodeType, parameter, cause);
    }

    /** The parameter (input socket) the failure was attributed to, if any. */
    public String parameter() {
        return socketName();
    }
}
