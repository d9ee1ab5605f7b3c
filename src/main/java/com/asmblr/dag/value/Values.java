package com.asmblr.dag.value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Static factories and readers for {@link Value}s.
 */
public final class Values {
    private Values() {
        // Utility class
    }

    public static Value none() {
        return NoneValue.INSTANCE;
    }

    public static Value of(boolean b) {
        return b ? BoolValue.TRUE : BoolValue.FALSE;
    }

    public static Value of(String s) {
        return s == null ? none() : new StringValue(s);
    }

    public static Value of(long n) {
        return NumberValue.of(n);
    }

    public static Value of(double n) {
        return NumberValue.of(n);
    }

    public static TupleValue tuple(Object... elements) {
        List<Value> values = new ArrayList<>(elements.length);
        for (Object e : elements)
            values.add(of(e));
        return new TupleValue(values);
    }

    /**
     * Adapts a plain Java object.
     *
     * <p>
     * {@code null} becomes none; booleans, strings and numbers map to their
     * variants; collections and object arrays become tuples; {@code float[]},
     * {@code double[]}, {@code int[]} and {@code long[]} become flat binary
     * arrays. Anything else is rendered into an {@link OtherValue}.
     */
    public static Value of(Object o) {
        if (o == null)
            return none();
        if (o instanceof Value v)
            return v;
        if (o instanceof Boolean b)
            return of(b.booleanValue());
        if (o instanceof CharSequence s)
            return new StringValue(s.toString());
        if (o instanceof Character c)
            return new StringValue(c.toString());
        if (o instanceof Number n)
            return new NumberValue(n);
        if (o instanceof Collection<?> c) {
            List<Value> values = new ArrayList<>(c.size());
            for (Object e : c)
                values.add(of(e));
            return new TupleValue(values);
        }
        if (o instanceof Object[] arr)
            return tuple(arr);
        if (o instanceof float[] f)
            return BinaryValue.ofFloats(f);
        if (o instanceof double[] d)
            return BinaryValue.ofDoubles(d);
        if (o instanceof int[] i)
            return BinaryValue.ofInts(i);
        if (o instanceof long[] l)
            return BinaryValue.ofLongs(l);
        return new OtherValue(o.getClass().getName(), String.valueOf(o));
    }

    /**
     * Reads a numeric scalar, accepting either a {@link NumberValue} or a
     * one-element tuple holding one (the shape numbers take after a round trip
     * through the wire format).
     *
     * @throws IllegalArgumentException if the value is not numeric.
     */
    public static double asDouble(Value v) {
        return asNumber(v).doubleValue();
    }

    public static long asLong(Value v) {
        return asNumber(v).longValue();
    }

    public static boolean isNumeric(Value v) {
        if (v instanceof NumberValue)
            return true;
        return v instanceof TupleValue t && t.size() == 1 && t.get(0) instanceof NumberValue;
    }

    public static NumberValue asNumber(Value v) {
        if (v instanceof NumberValue n)
            return n;
        if (v instanceof TupleValue t && t.size() == 1 && t.get(0) instanceof NumberValue n)
            return n;
        throw new IllegalArgumentException("Expected a number but got " + describe(v));
    }

    public static String asString(Value v) {
        if (v instanceof StringValue s)
            return s.value();
        throw new IllegalArgumentException("Expected a string but got " + describe(v));
    }

    public static boolean asBoolean(Value v) {
        if (v instanceof BoolValue b)
            return b.value();
        throw new IllegalArgumentException("Expected a bool but got " + describe(v));
    }

    /** Wraps a non-tuple value into a one-element tuple; tuples pass through. */
    public static TupleValue asTuple(Value v) {
        return v instanceof TupleValue t ? t : TupleValue.of(v);
    }

    static String describe(Value v) {
        return v == null ? "nothing" : v.kind().name().toLowerCase() + " " + v;
    }
}
