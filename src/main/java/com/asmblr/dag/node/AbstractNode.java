package com.asmblr.dag.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.api.NodeSchema;
import com.asmblr.dag.error.EvaluationException;
import com.asmblr.dag.error.NodeConstructionException;
import com.asmblr.dag.error.SocketReferenceException;
import com.asmblr.dag.fn.ArgumentException;
import com.asmblr.dag.value.Value;

import lombok.extern.log4j.Log4j2;

/**
 * Base class for nodes: socket bookkeeping, memoized evaluation and recursive
 * invalidation.
 *
 * <p>
 * Design:
 * - Template Method: {@link #evaluate()} is final. It resolves the inputs,
 * hands them to {@link #construct(Map)} and caches what comes back. Subclasses
 * only implement {@code construct}.
 * - State: a node is either unevaluated (empty cache) or evaluated (cache
 * populated). Only {@link #cleanGraph()} goes back from evaluated to
 * unevaluated.
 * - Failure: a failed construction leaves the cache empty. Caches of upstream
 * nodes that were already evaluated are untouched.
 */
@Log4j2
public abstract class AbstractNode implements Node {
    private final String id;
    private final NodeSchema schema;
    private final Map<String, InputSocket> inputSockets;
    private final Map<String, OutputSocket> outputSockets;

    private final Map<String, Value> resolved = new LinkedHashMap<>();
    private final Map<String, Value> cache = new LinkedHashMap<>();

    // false once evaluate() has been entered; cleanGraph() resets it
    private boolean clean = true;
    private boolean evaluating;

    protected AbstractNode(String id, NodeSchema schema) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.schema = schema;

        Map<String, InputSocket> ins = new LinkedHashMap<>();
        for (NodeSchema.InputSpec spec : schema.inputs())
            ins.put(spec.name(), new InputSocket(spec, this));
        this.inputSockets = Collections.unmodifiableMap(ins);

        Map<String, OutputSocket> outs = new LinkedHashMap<>();
        for (String name : schema.outputs())
            outs.put(name, new OutputSocket(name, this));
        this.outputSockets = Collections.unmodifiableMap(outs);

        for (NodeSchema.InputSpec spec : schema.inputs()) {
            if (spec.defaultValue().isNone())
                continue;
            try {
                ins.get(spec.name()).setValue(spec.defaultValue());
            } catch (RuntimeException e) {
                throw new NodeConstructionException("Failed to apply default for socket '" + spec.name() + "'",
                        this.id, schema.typeName(), e);
            }
        }
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final NodeSchema schema() {
        return schema;
    }

    @Override
    public final Map<String, InputSocket> inputSockets() {
        return inputSockets;
    }

    @Override
    public final Map<String, OutputSocket> outputSockets() {
        return outputSockets;
    }

    @Override
    public final InputSocket inputSocket(String name) {
        InputSocket s = inputSockets.get(name);
        if (s == null)
            throw new SocketReferenceException("No input socket named '" + name + "'", id, typeName(), name);
        return s;
    }

    @Override
    public final OutputSocket outputSocket(String name) {
        OutputSocket s = outputSockets.get(name);
        if (s == null)
            throw new SocketReferenceException("No output socket named '" + name + "'", id, typeName(), name);
        return s;
    }

    /**
     * Builds this node's outputs from its resolved inputs.
     *
     * @param resolvedInputs inputs that resolved to a value, by socket name
     *                       (read-only). Inputs that resolved to none are
     *                       absent.
     * @return the named outputs.
     */
    protected abstract Map<String, Value> construct(Map<String, Value> resolvedInputs);

    @Override
    public final Map<String, Value> evaluate() {
        clean = false;
        if (!cache.isEmpty())
            return outputs();
        if (evaluating)
            throw new EvaluationException("Node re-entered while being evaluated; the graph has a cycle", id,
                    typeName(), null);

        evaluating = true;
        try {
            resolved.clear();
            for (InputSocket socket : inputSockets.values()) {
                Value v = socket.resolve();
                if (!v.isNone())
                    resolved.put(socket.name(), v);
            }

            Map<String, Value> produced = construct(Collections.unmodifiableMap(resolved));
            checkOutputs(produced);
            cache.putAll(produced);
            log.debug("Evaluated {} ({}) -> {}", id, typeName(), cache.keySet());
            return outputs();
        } catch (EvaluationException e) {
            resolved.clear();
            throw e;
        } catch (ArgumentException e) {
            resolved.clear();
            throw new EvaluationException(e.getMessage(), id, typeName(), e.parameter(), e);
        } catch (RuntimeException e) {
            resolved.clear();
            throw new EvaluationException("Expression construction failed: " + e.getMessage(), id, typeName(),
                    null, e);
        } finally {
            evaluating = false;
        }
    }

    private void checkOutputs(Map<String, Value> produced) {
        if (produced == null || produced.isEmpty())
            throw new EvaluationException("Expression construction produced no outputs", id, typeName(), null);
        for (Map.Entry<String, Value> e : produced.entrySet()) {
            if (!outputSockets.containsKey(e.getKey()))
                throw new EvaluationException("Produced undeclared output '" + e.getKey() + "'", id, typeName(),
                        null);
            if (e.getValue() == null)
                throw new EvaluationException("Produced a null value for output '" + e.getKey() + "'", id,
                        typeName(), null);
        }
    }

    @Override
    public final Map<String, Value> outputs() {
        return Collections.unmodifiableMap(cache);
    }

    @Override
    public final Map<String, Value> resolvedInputs() {
        return Collections.unmodifiableMap(resolved);
    }

    @Override
    public final boolean isEvaluated() {
        return !cache.isEmpty();
    }

    @Override
    public final void cleanGraph() {
        if (clean)
            return;
        cache.clear();
        resolved.clear();
        clean = true;
        log.trace("Invalidated {} ({})", id, typeName());
        for (InputSocket socket : inputSockets.values()) {
            for (Connection c : socket.connections())
                c.source().cleanGraph();
        }
    }

    @Override
    public String toString() {
        return typeName() + "#" + id;
    }
}
