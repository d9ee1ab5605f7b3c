package com.asmblr.dag.value;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * A fixed-shape buffer of primitive elements, stored as raw little-endian bytes.
 *
 * <p>
 * Two layouts exist: {@link Layout#TENSOR} carries a device tag (informational
 * only) and {@link Layout#ARRAY} does not. The byte payload is copied on the way
 * in and on the way out, so instances are immutable and equality is bit-exact.
 */
public final class BinaryValue implements Value {
    public static final String DEFAULT_DEVICE = "cpu";

    private final Layout layout;
    private final byte[] data;
    private final int[] shape;
    private final DType dtype;
    private final String device;

    private BinaryValue(Layout layout, byte[] data, int[] shape, DType dtype, String device) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.dtype = Objects.requireNonNull(dtype, "dtype");
        this.shape = shape.clone();
        this.data = data.clone();
        this.device = layout == Layout.TENSOR ? (device != null ? device : DEFAULT_DEVICE) : null;

        long expected = (long) elementCount(this.shape) * dtype.itemSize();
        if (expected != this.data.length)
            throw new IllegalArgumentException("Shape " + Arrays.toString(this.shape) + " of " + dtype.wireName()
                    + " needs " + expected + " bytes but payload has " + this.data.length);
    }

    public static BinaryValue array(byte[] data, DType dtype, int... shape) {
        return new BinaryValue(Layout.ARRAY, data, shape, dtype, null);
    }

    public static BinaryValue tensor(byte[] data, DType dtype, String device, int... shape) {
        return new BinaryValue(Layout.TENSOR, data, shape, dtype, device);
    }

    public static BinaryValue ofFloats(float[] values, int... shape) {
        ByteBuffer buf = allocate(values.length * 4);
        for (float v : values)
            buf.putFloat(v);
        return array(buf.array(), DType.FLOAT32, shapeOrFlat(shape, values.length));
    }

    public static BinaryValue ofDoubles(double[] values, int... shape) {
        ByteBuffer buf = allocate(values.length * 8);
        for (double v : values)
            buf.putDouble(v);
        return array(buf.array(), DType.FLOAT64, shapeOrFlat(shape, values.length));
    }

    public static BinaryValue ofInts(int[] values, int... shape) {
        ByteBuffer buf = allocate(values.length * 4);
        for (int v : values)
            buf.putInt(v);
        return array(buf.array(), DType.INT32, shapeOrFlat(shape, values.length));
    }

    public static BinaryValue ofLongs(long[] values, int... shape) {
        ByteBuffer buf = allocate(values.length * 8);
        for (long v : values)
            buf.putLong(v);
        return array(buf.array(), DType.INT64, shapeOrFlat(shape, values.length));
    }

    /** Returns the same payload re-tagged as a tensor on the given device. */
    public BinaryValue asTensor(String device) {
        return new BinaryValue(Layout.TENSOR, data, shape, dtype, device);
    }

    public Layout layout() {
        return layout;
    }

    public DType dtype() {
        return dtype;
    }

    /** Device tag; {@code null} for the array layout. */
    public String device() {
        return device;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int elementCount() {
        return elementCount(shape);
    }

    /** A copy of the raw little-endian payload. */
    public byte[] bytes() {
        return data.clone();
    }

    public int byteLength() {
        return data.length;
    }

    public float[] toFloats() {
        requireDType(DType.FLOAT32);
        ByteBuffer buf = wrap();
        float[] out = new float[elementCount()];
        for (int i = 0; i < out.length; i++)
            out[i] = buf.getFloat();
        return out;
    }

    public double[] toDoubles() {
        requireDType(DType.FLOAT64);
        ByteBuffer buf = wrap();
        double[] out = new double[elementCount()];
        for (int i = 0; i < out.length; i++)
            out[i] = buf.getDouble();
        return out;
    }

    public int[] toInts() {
        requireDType(DType.INT32);
        ByteBuffer buf = wrap();
        int[] out = new int[elementCount()];
        for (int i = 0; i < out.length; i++)
            out[i] = buf.getInt();
        return out;
    }

    public long[] toLongs() {
        requireDType(DType.INT64);
        ByteBuffer buf = wrap();
        long[] out = new long[elementCount()];
        for (int i = 0; i < out.length; i++)
            out[i] = buf.getLong();
        return out;
    }

    @Override
    public Kind kind() {
        return Kind.BINARY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BinaryValue other))
            return false;
        return layout == other.layout && dtype == other.dtype
                && Objects.equals(device, other.device)
                && Arrays.equals(shape, other.shape)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(layout, dtype, device);
        h = 31 * h + Arrays.hashCode(shape);
        return 31 * h + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(layout == Layout.TENSOR ? "tensor" : "array")
                .append('(').append(dtype.wireName()).append(", shape=").append(Arrays.toString(shape));
        if (device != null)
            sb.append(", device=").append(device);
        return sb.append(')').toString();
    }

    private void requireDType(DType expected) {
        if (dtype != expected)
            throw new IllegalStateException("Buffer holds " + dtype.wireName() + ", not " + expected.wireName());
    }

    private ByteBuffer wrap() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static ByteBuffer allocate(int bytes) {
        return ByteBuffer.allocate(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static int[] shapeOrFlat(int[] shape, int length) {
        return shape.length == 0 ? new int[] { length } : shape;
    }

    static int elementCount(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            if (dim < 0)
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            count *= dim;
            if (count > Integer.MAX_VALUE)
                throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " is too large");
        }
        return (int) count;
    }

    /** Buffer layout, mirrored by the {@code binary_tensor} and {@code binary_array} wire tags. */
    public enum Layout {
        TENSOR, ARRAY
    }
}
