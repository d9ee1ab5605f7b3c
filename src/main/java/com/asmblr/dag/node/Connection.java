package com.asmblr.dag.node;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.error.SocketReferenceException;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

/**
 * Directed edge from an output socket of a source node to an input socket of a
 * target node.
 *
 * <p>
 * Both sockets are validated before anything is registered, so a failed
 * construction leaves the graph untouched. A successful one registers the edge
 * with both sockets; call {@link #delete()} to unregister it before dropping it,
 * otherwise the source keeps a dangling fan-out entry.
 */
public final class Connection {
    private final Node source;
    private final String sourceOutput;
    private final Node target;
    private final String targetInput;

    /**
     * Connects {@code source.sourceOutput} to {@code target.targetInput}.
     *
     * @throws SocketReferenceException if either socket does not exist.
     * @throws IllegalArgumentException if source and target are the same node.
     */
    public Connection(Node source, String sourceOutput, Node target, String targetInput) {
        if (source == target)
            throw new IllegalArgumentException("Self-connection not allowed on node " + source.id());

        OutputSocket out = source.outputSockets().get(sourceOutput);
        if (out == null)
            throw new SocketReferenceException("Output socket '" + sourceOutput + "' does not exist on source node",
                    source.id(), source.typeName(), sourceOutput);
        InputSocket in = target.inputSockets().get(targetInput);
        if (in == null)
            throw new SocketReferenceException("Input socket '" + targetInput + "' does not exist on target node",
                    target.id(), target.typeName(), targetInput);

        this.source = source;
        this.sourceOutput = sourceOutput;
        this.target = target;
        this.targetInput = targetInput;

        out.attach(this);
        in.attach(this);
    }

    /** Connects the first output of {@code source} to {@code target.targetInput}. */
    public static Connection from(Node source, Node target, String targetInput) {
        String output = source.schema().outputs().get(0);
        return new Connection(source, output, target, targetInput);
    }

    public Node source() {
        return source;
    }

    public String sourceOutput() {
        return sourceOutput;
    }

    public Node target() {
        return target;
    }

    public String targetInput() {
        return targetInput;
    }

    /** Evaluates the source node and returns the output this edge reads. */
    public Value pull() {
        Value v = source.evaluate().get(sourceOutput);
        return v == null ? Values.none() : v;
    }

    /** Unregisters this edge from both of its sockets. Idempotent. */
    public void delete() {
        source.outputSockets().get(sourceOutput).detach(this);
        target.inputSockets().get(targetInput).detach(this);
    }

    @Override
    public String toString() {
        return source.typeName() + ":" + sourceOutput + " -> " + target.typeName() + ":" + targetInput;
    }
}
