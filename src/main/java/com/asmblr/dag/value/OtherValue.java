package com.asmblr.dag.value;

import java.util.Objects;

/**
 * Fallback for values that have no dedicated variant.
 *
 * <p>
 * Only the rendered text and the name of the original Java type survive. Decoding
 * re-parses the text on a best-effort basis, so a round trip through the wire
 * format may yield a different variant or lose information entirely.
 */
public record OtherValue(String typeName, String text) implements Value {

    public OtherValue {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public Kind kind() {
        return Kind.OTHER;
    }

    @Override
    public String toString() {
        return text;
    }
}
