package com.asmblr.dag.value;

/**
 * A direct value held by an input socket or produced by a node output.
 *
 * <p>
 * The set of variants is closed: {@link NoneValue}, {@link BoolValue},
 * {@link StringValue}, {@link NumberValue}, {@link TupleValue},
 * {@link BinaryValue} and the lossy {@link OtherValue} fallback. Every variant
 * is immutable and implements value equality, so a value can be shared between
 * sockets and caches without copying.
 */
public interface Value {

    /** The variant of this value. */
    Kind kind();

    default boolean isNone() {
        return kind() == Kind.NONE;
    }

    /** Discriminator for the value variants. */
    enum Kind {
        NONE, BOOL, STRING, NUMBER, TUPLE, BINARY, OTHER
    }
}
