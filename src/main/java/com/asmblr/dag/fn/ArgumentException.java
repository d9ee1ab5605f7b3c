package com.asmblr.dag.fn;

/**
 * Thrown by an {@link ExpressionBuilder} (or by {@link Arguments}) when a
 * parameter is missing or has the wrong kind.
 */
public class ArgumentException extends RuntimeException {
    private final String parameter;

    public ArgumentException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public ArgumentException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
