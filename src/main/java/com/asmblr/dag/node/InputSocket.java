package com.asmblr.dag.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.api.NodeSchema;
import com.asmblr.dag.value.TupleValue;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

/**
 * Named input of a node.
 *
 * <p>
 * Holds exactly one binding: a direct value (possibly none) or a non-empty,
 * ordered list of connections. Setting a value drops the connections, and
 * connecting drops the value.
 */
public final class InputSocket {
    private final NodeSchema.InputSpec spec;
    private final Node owner;
    private Binding binding;

    public InputSocket(NodeSchema.InputSpec spec, Node owner) {
        this.spec = spec;
        this.owner = owner;
        this.binding = new Direct(Values.none());
    }

    public String name() {
        return spec.name();
    }

    public Node owner() {
        return owner;
    }

    /** Optional type hint from the schema; informational. */
    public String typeHint() {
        return spec.typeHint();
    }

    /** The schema default applied at construction; none when there is no default. */
    public Value defaultValue() {
        return spec.defaultValue();
    }

    /** True for the collector input that accepts fan-in. */
    public boolean isVariadic() {
        return spec.variadic();
    }

    public boolean isConnected() {
        return binding instanceof Wired;
    }

    /** True when a direct, non-none value is set. */
    public boolean hasValue() {
        return binding instanceof Direct d && !d.value().isNone();
    }

    /** The direct value; none when the socket is connected or unset. */
    public Value value() {
        return binding instanceof Direct d ? d.value() : Values.none();
    }

    public List<Connection> connections() {
        return binding instanceof Wired w ? Collections.unmodifiableList(w.connections()) : List.of();
    }

    public int connectionCount() {
        return binding instanceof Wired w ? w.connections().size() : 0;
    }

    /**
     * Binds a direct value. Any existing connections into this socket are
     * deleted from both of their endpoints first.
     */
    public void setValue(Value value) {
        disconnect();
        binding = new Direct(value == null ? Values.none() : value);
    }

    /** Adapts {@code value} with {@link Values#of(Object)} and binds it. */
    public void set(Object value) {
        setValue(Values.of(value));
    }

    /** Returns the socket to the unset state, deleting its connections. */
    public void clear() {
        setValue(Values.none());
    }

    /** Deletes every connection feeding this socket. */
    public void disconnect() {
        if (binding instanceof Wired w) {
            for (Connection c : new ArrayList<>(w.connections()))
                c.delete();
        }
    }

    /**
     * Resolves the socket. A connected socket evaluates each source node and
     * yields the single upstream output, or a tuple of them in connection order
     * when there is fan-in. An unconnected socket yields its direct value.
     */
    public Value resolve() {
        if (binding instanceof Wired w) {
            List<Connection> conns = w.connections();
            if (conns.size() == 1)
                return conns.get(0).pull();
            List<Value> values = new ArrayList<>(conns.size());
            for (Connection c : new ArrayList<>(conns))
                values.add(c.pull());
            return new TupleValue(values);
        }
        return ((Direct) binding).value();
    }

    void attach(Connection c) {
        if (binding instanceof Wired w) {
            w.connections().add(c);
        } else {
            List<Connection> conns = new ArrayList<>();
            conns.add(c);
            binding = new Wired(conns);
        }
    }

    void detach(Connection c) {
        if (binding instanceof Wired w) {
            w.connections().remove(c);
            if (w.connections().isEmpty())
                binding = new Direct(Values.none());
        }
    }

    @Override
    public String toString() {
        return owner.typeName() + ":" + name();
    }

    private interface Binding {
    }

    private record Direct(Value value) implements Binding {
    }

    private record Wired(List<Connection> connections) implements Binding {
    }
}
