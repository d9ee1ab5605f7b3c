package com.asmblr.dag.fn;

import java.util.Map;

import com.asmblr.dag.value.Value;

/**
 * Builds a node's expression from its resolved inputs.
 *
 * <p>
 * Called at most once per evaluation of a node. Implementations must be pure:
 * no side effects visible to the graph, and the {@link Arguments} must not be
 * retained. Reject a bad parameter by throwing {@link ArgumentException}; the
 * node attributes the failure to itself.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code args -> Map.of("out", Values.of(args.number("a") + args.number("b")))}</li>
 * <li>{@code args -> Map.of("out", args.get("value"))}</li>
 * </ul>
 */
@FunctionalInterface
public interface ExpressionBuilder {

    /**
     * @param args the resolved inputs.
     * @return the named outputs; at least one, each naming a declared output
     *         socket.
     */
    Map<String, Value> build(Arguments args);
}
