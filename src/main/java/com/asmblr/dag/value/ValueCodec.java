package com.asmblr.dag.value;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.asmblr.dag.error.ValueDecodeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts {@link Value}s to and from their tagged {@link EncodedValue} form.
 *
 * <p>
 * Tags:
 * <ul>
 * <li>{@code none}, {@code bool}, {@code string}: payload is the JSON
 * literal.</li>
 * <li>{@code tuple}: payload is a JSON array. Numeric scalars are written as
 * one-element tuples, so {@code decode(encode(2))} yields {@code (2,)}.</li>
 * <li>{@code binary_tensor}, {@code binary_array}: raw little-endian bytes,
 * gzip-compressed and Base64-armoured, with {@code shape} and {@code dtype}
 * (both required to decode).</li>
 * <li>{@code other}: rendered text, re-parsed best-effort on decode. Lossy.</li>
 * </ul>
 * Binary and other values nested inside a tuple are written as nested tagged
 * objects.
 */
public final class ValueCodec {
    public static final String NONE = "none";
    public static final String BOOL = "bool";
    public static final String STRING = "string";
    public static final String TUPLE = "tuple";
    public static final String BINARY_TENSOR = "binary_tensor";
    public static final String BINARY_ARRAY = "binary_array";
    public static final String OTHER = "other";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final int compressionLevel;

    public ValueCodec() {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    /**
     * @param compressionLevel deflate level for binary payloads, {@code -1}
     *                         (default) or {@code 0..9}.
     */
    public ValueCodec(int compressionLevel) {
        if (compressionLevel < Deflater.DEFAULT_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION)
            throw new IllegalArgumentException("Compression level out of range: " + compressionLevel);
        this.compressionLevel = compressionLevel;
    }

    // ── Encode ──────────────────────────────────────────────────────

    public EncodedValue encode(Value value) {
        EncodedValue ev = new EncodedValue();
        if (value == null || value instanceof NoneValue) {
            ev.setType(NONE);
            ev.setData(NullNode.getInstance());
        } else if (value instanceof BoolValue b) {
            ev.setType(BOOL);
            ev.setData(NODES.booleanNode(b.value()));
        } else if (value instanceof StringValue s) {
            ev.setType(STRING);
            ev.setData(NODES.textNode(s.value()));
        } else if (value instanceof NumberValue n) {
            ev.setType(TUPLE);
            ev.setData(NODES.arrayNode().add(numberNode(n)));
        } else if (value instanceof TupleValue t) {
            ev.setType(TUPLE);
            ev.setData(tupleNode(t));
        } else if (value instanceof BinaryValue bin) {
            ev.setType(bin.layout() == BinaryValue.Layout.TENSOR ? BINARY_TENSOR : BINARY_ARRAY);
            ev.setData(NODES.textNode(Base64.getEncoder().encodeToString(compress(bin.bytes()))));
            List<Integer> shape = new ArrayList<>();
            for (int dim : bin.shape())
                shape.add(dim);
            ev.setShape(shape);
            ev.setDtype(bin.dtype().wireName());
            ev.setDevice(bin.device());
        } else if (value instanceof OtherValue o) {
            ev.setType(OTHER);
            ev.setData(NODES.textNode(o.text()));
            ev.setSourceType(o.typeName());
        } else {
            throw new IllegalArgumentException("Unsupported value variant: " + value.getClass().getName());
        }
        return ev;
    }

    private ArrayNode tupleNode(TupleValue t) {
        ArrayNode arr = NODES.arrayNode(t.size());
        for (Value e : t)
            arr.add(elementNode(e));
        return arr;
    }

    private JsonNode elementNode(Value e) {
        if (e instanceof NoneValue)
            return NullNode.getInstance();
        if (e instanceof BoolValue b)
            return NODES.booleanNode(b.value());
        if (e instanceof StringValue s)
            return NODES.textNode(s.value());
        if (e instanceof NumberValue n)
            return numberNode(n);
        if (e instanceof TupleValue t)
            return tupleNode(t);
        return toTree(encode(e));
    }

    private static JsonNode numberNode(NumberValue n) {
        return n.isIntegral() ? NODES.numberNode(n.longValue()) : NODES.numberNode(n.doubleValue());
    }

    private static ObjectNode toTree(EncodedValue ev) {
        ObjectNode obj = NODES.objectNode();
        obj.put("type", ev.getType());
        obj.set("data", ev.getData());
        if (ev.getShape() != null) {
            ArrayNode shape = obj.putArray("shape");
            ev.getShape().forEach(shape::add);
        }
        if (ev.getDtype() != null)
            obj.put("dtype", ev.getDtype());
        if (ev.getDevice() != null)
            obj.put("device", ev.getDevice());
        if (ev.getSourceType() != null)
            obj.put("class", ev.getSourceType());
        return obj;
    }

    // ── Decode ──────────────────────────────────────────────────────

    /**
     * Reconstructs a value.
     *
     * @throws ValueDecodeException on an unknown tag, a payload of the wrong JSON
     *                              shape, or binary metadata inconsistent with
     *                              the payload.
     */
    public Value decode(EncodedValue ev) {
        if (ev == null || ev.getType() == null)
            throw new ValueDecodeException("Encoded value has no 'type'");
        JsonNode data = ev.getData() == null ? NullNode.getInstance() : ev.getData();
        return switch (ev.getType()) {
            case NONE -> Values.none();
            case BOOL -> {
                if (!data.isBoolean())
                    throw new ValueDecodeException("'bool' payload is not a boolean: " + data);
                yield Values.of(data.booleanValue());
            }
            case STRING -> {
                if (!data.isTextual())
                    throw new ValueDecodeException("'string' payload is not text: " + data);
                yield new StringValue(data.textValue());
            }
            case TUPLE -> {
                if (!data.isArray())
                    throw new ValueDecodeException("'tuple' payload is not an array: " + data);
                yield decodeTuple(data);
            }
            case BINARY_TENSOR, BINARY_ARRAY -> decodeBinary(ev, data);
            case OTHER -> decodeOther(ev, data);
            default -> throw new ValueDecodeException("Unknown value type tag '" + ev.getType() + "'");
        };
    }

    private TupleValue decodeTuple(JsonNode arr) {
        List<Value> elements = new ArrayList<>(arr.size());
        for (JsonNode e : arr)
            elements.add(decodeElement(e));
        return new TupleValue(elements);
    }

    private Value decodeElement(JsonNode e) {
        if (e == null || e.isNull() || e.isMissingNode())
            return Values.none();
        if (e.isBoolean())
            return Values.of(e.booleanValue());
        if (e.isTextual())
            return new StringValue(e.textValue());
        if (e.isIntegralNumber() && e.canConvertToLong())
            return NumberValue.of(e.longValue());
        if (e.isNumber())
            return NumberValue.of(e.doubleValue());
        if (e.isArray())
            return decodeTuple(e);
        if (e.isObject() && e.has("type"))
            return decode(fromTree(e));
        throw new ValueDecodeException("Unsupported tuple element: " + e);
    }

    private static EncodedValue fromTree(JsonNode obj) {
        EncodedValue ev = new EncodedValue();
        ev.setType(obj.path("type").asText(null));
        ev.setData(obj.get("data"));
        JsonNode shape = obj.get("shape");
        if (shape != null && shape.isArray()) {
            List<Integer> dims = new ArrayList<>(shape.size());
            shape.forEach(d -> dims.add(d.intValue()));
            ev.setShape(dims);
        }
        ev.setDtype(obj.hasNonNull("dtype") ? obj.get("dtype").asText() : null);
        ev.setDevice(obj.hasNonNull("device") ? obj.get("device").asText() : null);
        ev.setSourceType(obj.hasNonNull("class") ? obj.get("class").asText() : null);
        return ev;
    }

    private BinaryValue decodeBinary(EncodedValue ev, JsonNode data) {
        String tag = ev.getType();
        if (!data.isTextual())
            throw new ValueDecodeException("'" + tag + "' payload is not Base64 text");
        if (ev.getShape() == null)
            throw new ValueDecodeException("'" + tag + "' is missing 'shape'");
        if (ev.getDtype() == null)
            throw new ValueDecodeException("'" + tag + "' is missing 'dtype'");

        DType dtype;
        try {
            dtype = DType.fromWireName(ev.getDtype());
        } catch (IllegalArgumentException e) {
            throw new ValueDecodeException("'" + tag + "' has unsupported dtype '" + ev.getDtype() + "'", e);
        }

        int[] shape = new int[ev.getShape().size()];
        for (int i = 0; i < shape.length; i++) {
            Integer dim = ev.getShape().get(i);
            if (dim == null)
                throw new ValueDecodeException("'" + tag + "' shape has a null dimension");
            shape[i] = dim;
        }

        byte[] raw;
        try {
            raw = decompress(Base64.getDecoder().decode(data.textValue()));
        } catch (IllegalArgumentException | IOException e) {
            throw new ValueDecodeException("'" + tag + "' payload could not be unpacked", e);
        }

        try {
            return tag.equals(BINARY_TENSOR)
                    ? BinaryValue.tensor(raw, dtype, ev.getDevice(), shape)
                    : BinaryValue.array(raw, dtype, shape);
        } catch (IllegalArgumentException e) {
            throw new ValueDecodeException("'" + tag + "' metadata does not match payload: " + e.getMessage(), e);
        }
    }

    private Value decodeOther(EncodedValue ev, JsonNode data) {
        if (data.isNull())
            return Values.none();
        String text = data.isTextual() ? data.textValue() : data.toString();
        try {
            return LiteralParser.parse(text);
        } catch (IllegalArgumentException e) {
            return new OtherValue(ev.getSourceType(), text);
        }
    }

    // ── Compression ─────────────────────────────────────────────────

    private byte[] compress(byte[] raw) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try (GZIPOutputStream gz = new LeveledGzipOutputStream(bos, compressionLevel)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory compression failed", e);
        }
        return bos.toByteArray();
    }

    private static byte[] decompress(byte[] packed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(packed))) {
            return in.readAllBytes();
        }
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
