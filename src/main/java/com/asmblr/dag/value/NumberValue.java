package com.asmblr.dag.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A numeric scalar.
 *
 * <p>
 * Integral inputs are normalised to {@link Long}, everything else to
 * {@link Double}, so {@code 2} and {@code 2L} compare equal while {@code 2} and
 * {@code 2.0} do not. On the wire a number is always written as a one-element
 * tuple.
 */
public record NumberValue(Number value) implements Value {
    private static final BigDecimal LONG_LIMIT = BigDecimal.valueOf(Long.MAX_VALUE);

    public NumberValue {
        Objects.requireNonNull(value, "value");
        value = normalise(value);
    }

    public static NumberValue of(long value) {
        return new NumberValue(value);
    }

    public static NumberValue of(double value) {
        return new NumberValue(value);
    }

    public boolean isIntegral() {
        return value instanceof Long;
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    public long longValue() {
        return value.longValue();
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }

    @Override
    public String toString() {
        return value.toString();
    }

    private static Number normalise(Number n) {
        if (n instanceof Long)
            return n;
        if (n instanceof Integer || n instanceof Short || n instanceof Byte)
            return n.longValue();
        if (n instanceof BigInteger big) {
            if (big.bitLength() < 64)
                return Long.valueOf(big.longValue());
            return Double.valueOf(big.doubleValue());
        }
        if (n instanceof BigDecimal dec && dec.stripTrailingZeros().scale() <= 0 && dec.abs().compareTo(LONG_LIMIT) < 0)
            return Long.valueOf(dec.longValue());
        return Double.valueOf(n.doubleValue());
    }
}
