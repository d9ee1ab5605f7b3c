package com.asmblr.dag.value;

/** The absent value. A socket holding it counts as unset. */
public final class NoneValue implements Value {
    static final NoneValue INSTANCE = new NoneValue();

    private NoneValue() {
    }

    @Override
    public Kind kind() {
        return Kind.NONE;
    }

    @Override
    public String toString() {
        return "None";
    }
}
