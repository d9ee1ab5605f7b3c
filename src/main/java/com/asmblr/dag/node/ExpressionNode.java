package com.asmblr.dag.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.asmblr.dag.api.NodeSchema;
import com.asmblr.dag.fn.Arguments;
import com.asmblr.dag.fn.ExpressionBuilder;
import com.asmblr.dag.value.TupleValue;
import com.asmblr.dag.value.Value;

/**
 * A general-purpose node that delegates expression construction to an
 * {@link ExpressionBuilder}.
 *
 * <p>
 * Positional arguments follow a contiguous-prefix policy: inputs are taken in
 * declaration order and the list stops at the first input that resolved to
 * nothing, dropping every later input. Inside the collector input the same rule
 * applies to its elements: the first missing element and everything after it
 * are discarded.
 */
public class ExpressionNode extends AbstractNode {
    private final ExpressionBuilder builder;

    public ExpressionNode(String id, NodeSchema schema, ExpressionBuilder builder) {
        super(id, schema);
        this.builder = builder;
    }

    @Override
    protected Map<String, Value> construct(Map<String, Value> resolvedInputs) {
        List<Value> collected = collect(resolvedInputs);
        List<Value> positional = new ArrayList<>();
        for (NodeSchema.InputSpec spec : schema().inputs()) {
            Value v = resolvedInputs.get(spec.name());
            if (v == null)
                break;
            if (spec.variadic()) {
                if (collected.isEmpty())
                    break;
                positional.addAll(collected);
            } else {
                positional.add(v);
            }
        }
        return builder.build(new Arguments(resolvedInputs, positional, collected));
    }

    private List<Value> collect(Map<String, Value> resolvedInputs) {
        Optional<NodeSchema.InputSpec> collector = schema().variadicInput();
        if (collector.isEmpty())
            return Collections.emptyList();
        String name = collector.get().name();
        Value v = resolvedInputs.get(name);
        if (v == null)
            return Collections.emptyList();

        // a single connection delivers one element even if that element is a tuple
        List<Value> elements = v instanceof TupleValue t && inputSocket(name).connectionCount() != 1
                ? t.elements()
                : List.of(v);

        List<Value> prefix = new ArrayList<>(elements.size());
        for (Value e : elements) {
            if (e.isNone())
                break;
            prefix.add(e);
        }
        return prefix;
    }
}
