package com.asmblr.dag.value;

/**
 * Element types of a {@link BinaryValue}, with their wire names and item sizes.
 */
public enum DType {
    FLOAT32("float32", 4),
    FLOAT64("float64", 8),
    INT8("int8", 1),
    INT16("int16", 2),
    INT32("int32", 4),
    INT64("int64", 8),
    UINT8("uint8", 1),
    BOOL("bool", 1);

    private static final String TORCH_PREFIX = "torch.";

    private final String wireName;
    private final int itemSize;

    DType(String wireName, int itemSize) {
        this.wireName = wireName;
        this.itemSize = itemSize;
    }

    public String wireName() {
        return wireName;
    }

    public int itemSize() {
        return itemSize;
    }

    /**
     * Parses a wire dtype name. Accepts the plain names and their
     * {@code torch.}-prefixed spelling.
     *
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static DType fromWireName(String text) {
        String name = text.startsWith(TORCH_PREFIX) ? text.substring(TORCH_PREFIX.length()) : text;
        for (DType d : values()) {
            if (d.wireName.equals(name))
                return d;
        }
        throw new IllegalArgumentException("Unknown dtype: " + text);
    }
}
