package com.asmblr.dag.api;

import java.util.Map;

import com.asmblr.dag.node.InputSocket;
import com.asmblr.dag.node.OutputSocket;
import com.asmblr.dag.value.Value;

/**
 * A node in the expression graph.
 *
 * <p>
 * A node owns named input and output sockets. Inputs are fed either by a direct
 * value or by connections from other nodes' outputs; the graph itself is never
 * materialised and is inferred by walking input connections backwards from any
 * node.
 *
 * <p>
 * Evaluation is lazy and memoized: {@link #evaluate()} resolves every input
 * (evaluating upstream nodes on demand), runs the node's expression construction
 * once and caches the named outputs. Further calls return the cache until
 * {@link #cleanGraph()} invalidates it. A node shared by several downstream
 * nodes is therefore constructed only once per dirty period.
 *
 * <p>
 * Not thread-safe. A node has a single cache slot, so concurrent evaluation of a
 * shared node races.
 */
public interface Node {

    /** Unique id, fixed at construction. */
    String id();

    /** Registered type name of this node. */
    default String typeName() {
        return schema().typeName();
    }

    /** The socket layout this node was built from. */
    NodeSchema schema();

    /** Input sockets by name, in declaration order. */
    Map<String, InputSocket> inputSockets();

    /** Output sockets by name, in declaration order. */
    Map<String, OutputSocket> outputSockets();

    /**
     * Looks up an input socket.
     *
     * @throws com.asmblr.dag.error.SocketReferenceException if there is none by
     *                                                       that name.
     */
    InputSocket inputSocket(String name);

    /**
     * Looks up an output socket.
     *
     * @throws com.asmblr.dag.error.SocketReferenceException if there is none by
     *                                                       that name.
     */
    OutputSocket outputSocket(String name);

    /**
     * Evaluates the node, or returns the cached outputs if it has been evaluated
     * since the last invalidation.
     *
     * @return the named outputs (read-only).
     * @throws com.asmblr.dag.error.EvaluationException if expression construction
     *                                                  fails here or upstream.
     */
    Map<String, Value> evaluate();

    /** The cached outputs; empty unless the node is evaluated. */
    Map<String, Value> outputs();

    /** The inputs resolved by the last evaluation; empty once invalidated. */
    Map<String, Value> resolvedInputs();

    /** True iff the output cache is populated. */
    boolean isEvaluated();

    /**
     * Clears this node's cache and, recursively, the caches of every node feeding
     * it. Nodes already clean are not revisited.
     */
    void cleanGraph();

    /** Total number of connections leaving this node, over all output sockets. */
    default int outboundConnectionCount() {
        int count = 0;
        for (OutputSocket out : outputSockets().values())
            count += out.connectionCount();
        return count;
    }

    /** A node with no outbound connections is a root (a sink of the graph). */
    default boolean isRoot() {
        return outboundConnectionCount() == 0;
    }
}
