package com.asmblr.dag.error;

/**
 * An encoded value was malformed: an unknown tag, missing or inconsistent
 * shape/dtype metadata, or a payload that could not be decompressed.
 */
public class ValueDecodeException extends GraphException {

    public ValueDecodeException(String message) {
        super(message, null, null, null);
    }

    public ValueDecodeException(String message, Throwable cause) {
        super(message, null, null, null, cause);
    }

    public ValueDecodeException(String message, String nodeId, String nodeType, String socketName,
            Throwable cause) {
        super(message, nodeId, nodeType, socketName, cause);
    }
}
