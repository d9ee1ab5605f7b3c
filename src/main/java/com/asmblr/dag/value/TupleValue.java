package com.asmblr.dag.value;

import java.util.Iterator;
import java.util.List;

/**
 * An ordered, immutable sequence of values.
 *
 * <p>
 * Also the shape fan-in takes: an input socket fed by several connections
 * resolves to a tuple of the upstream outputs in connection order.
 */
public record TupleValue(List<Value> elements) implements Value, Iterable<Value> {

    public TupleValue {
        elements = List.copyOf(elements);
    }

    public static TupleValue of(Value... elements) {
        return new TupleValue(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    public Value get(int index) {
        return elements.get(index);
    }

    @Override
    public Iterator<Value> iterator() {
        return elements.iterator();
    }

    @Override
    public Kind kind() {
        return Kind.TUPLE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(elements.get(i));
        }
        if (elements.size() == 1)
            sb.append(',');
        return sb.append(')').toString();
    }
}
