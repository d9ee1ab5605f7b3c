package com.asmblr.dag.fn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.asmblr.dag.value.TupleValue;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

/**
 * Read-only view of a node's resolved inputs, handed to an
 * {@link ExpressionBuilder}.
 *
 * <p>
 * Three views are offered:
 * <ul>
 * <li><b>named</b>: every input that resolved to something, by socket name;</li>
 * <li><b>positional</b>: inputs in declaration order, cut at the first input
 * that resolved to nothing, with the collector input expanded in place;</li>
 * <li><b>collected</b>: the elements gathered by the collector input, cut at the
 * first missing element.</li>
 * </ul>
 */
public final class Arguments {
    private final Map<String, Value> named;
    private final List<Value> positional;
    private final List<Value> collected;

    public Arguments(Map<String, Value> named, List<Value> positional, List<Value> collected) {
        this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        this.positional = List.copyOf(positional);
        this.collected = List.copyOf(collected);
    }

    /** Arguments with named inputs only, no positional or collected view. */
    public static Arguments named(Map<String, Value> named) {
        return new Arguments(named, List.of(), List.of());
    }

    public boolean has(String name) {
        return named.containsKey(name);
    }

    /** The resolved input, or none when it resolved to nothing. */
    public Value get(String name) {
        Value v = named.get(name);
        return v == null ? Values.none() : v;
    }

    /** The resolved input; fails when it resolved to nothing. */
    public Value require(String name) {
        Value v = named.get(name);
        if (v == null)
            throw new ArgumentException(name, "Missing required input '" + name + "'");
        return v;
    }

    public double number(String name) {
        Value v = require(name);
        try {
            return Values.asDouble(v);
        } catch (IllegalArgumentException e) {
            throw new ArgumentException(name, "Input '" + name + "': " + e.getMessage(), e);
        }
    }

    public double number(String name, double defaultValue) {
        return has(name) ? number(name) : defaultValue;
    }

    public String string(String name) {
        Value v = require(name);
        try {
            return Values.asString(v);
        } catch (IllegalArgumentException e) {
            throw new ArgumentException(name, "Input '" + name + "': " + e.getMessage(), e);
        }
    }

    public boolean bool(String name) {
        Value v = require(name);
        try {
            return Values.asBoolean(v);
        } catch (IllegalArgumentException e) {
            throw new ArgumentException(name, "Input '" + name + "': " + e.getMessage(), e);
        }
    }

    public TupleValue tuple(String name) {
        return Values.asTuple(require(name));
    }

    public Map<String, Value> named() {
        return named;
    }

    public List<Value> positional() {
        return positional;
    }

    public List<Value> collected() {
        return collected;
    }

    @Override
    public String toString() {
        return "Arguments" + named;
    }
}
