package io.avroxform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.avroxform.core.error.TypeMismatchException;
import io.avroxform.core.model.DeclaredType;
import io.avroxform.core.model.Value;
import io.avroxform.core.model.Value.ArrayValue;
import io.avroxform.core.model.Value.BoolValue;
import io.avroxform.core.model.Value.BytesValue;
import io.avroxform.core.model.Value.FloatValue;
import io.avroxform.core.model.Value.IntValue;
import io.avroxform.core.model.Value.NullValue;
import io.avroxform.core.model.Value.ObjectValue;
import io.avroxform.core.model.Value.TextValue;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;

/**
 * Renders leaf values as cell text according to a column's {@link DeclaredType}.
 *
 * <ul>
 * <li>{@code TIMESTAMP} — the value must be an integer holding whole seconds since the Unix
 * epoch; rendered as {@code yyyy-MM-dd HH:mm:ss} in the configured zone.</li>
 * <li>{@code PLAIN} — booleans as {@code true}/{@code false}, integers in decimal, floats as
 * plain decimals without trailing zeros, text as-is, bytes as {@code [65 66]}, arrays and objects
 * as compact JSON.</li>
 * <li>A null leaf renders as the empty string under either type.</li>
 * </ul>
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class FieldFormatter {

    /** Pattern used for timestamp cells. */
    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final DateTimeFormatter timestampFormatter;

    public FieldFormatter(ZoneId zoneId) {
        Objects.requireNonNull(zoneId, "zoneId must not be null");
        this.timestampFormatter = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN).withZone(zoneId);
    }

    /**
     * Formats {@code value} for a column of the given type.
     *
     * @throws TypeMismatchException if a timestamp column holds a non-integer value
     */
    public String format(Value value, DeclaredType type) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(type, "type must not be null");
        return switch (type) {
            case TIMESTAMP -> formatTimestamp(value);
            case PLAIN -> formatPlain(value);
        };
    }

    /** Formats an epoch-seconds integer; {@code null} renders as the empty string. */
    public String formatTimestamp(Value value) {
        if (value instanceof NullValue) {
            return "";
        }
        if (!(value instanceof IntValue seconds)) {
            throw new TypeMismatchException(
                    "timestamp column expects INT (epoch seconds), got " + value.tag(), null, null);
        }
        try {
            return timestampFormatter.format(Instant.ofEpochSecond(seconds.value()));
        } catch (DateTimeException e) {
            throw new TypeMismatchException("timestamp out of range: " + seconds.value(), e, null, null);
        }
    }

    /** Generic text form of any value. */
    public String formatPlain(Value value) {
        if (value instanceof NullValue) {
            return "";
        }
        if (value instanceof BoolValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof IntValue i) {
            return Long.toString(i.value());
        }
        if (value instanceof FloatValue f) {
            return formatFloat(f.value());
        }
        if (value instanceof TextValue t) {
            return t.value();
        }
        if (value instanceof BytesValue bytes) {
            return formatBytes(bytes.bytes());
        }
        try {
            return JSON.writeValueAsString(toJson(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render " + value.tag() + " as JSON", e);
        }
    }

    /**
     * Static-layout rendering of a byte sequence: its first byte as a one-character string.
     *
     * @throws TypeMismatchException if the value is not bytes or is empty
     */
    public static String firstByte(Value value) {
        if (!(value instanceof BytesValue bytes)) {
            throw new TypeMismatchException("expected BYTES, got " + value.tag(), null, null);
        }
        if (bytes.bytes().length == 0) {
            throw new TypeMismatchException("expected at least one byte, got an empty byte sequence", null, null);
        }
        return String.valueOf((char) (bytes.bytes()[0] & 0xFF));
    }

    static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0d) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String formatBytes(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 4 + 2).append('[');
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(bytes[i] & 0xFF);
        }
        return sb.append(']').toString();
    }

    /** Converts a value tree to Jackson nodes for JSON rendering of composite cells. */
    static JsonNode toJson(Value value) {
        if (value instanceof NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof BoolValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof IntValue i) {
            return NODES.numberNode(i.value());
        }
        if (value instanceof FloatValue f) {
            return NODES.numberNode(f.value());
        }
        if (value instanceof TextValue t) {
            return NODES.textNode(t.value());
        }
        if (value instanceof BytesValue bytes) {
            return NODES.binaryNode(bytes.bytes());
        }
        if (value instanceof ArrayValue array) {
            ArrayNode node = NODES.arrayNode(array.size());
            array.elements().forEach(element -> node.add(toJson(element)));
            return node;
        }
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, Value> field : ((ObjectValue) value).fields().entrySet()) {
            node.set(field.getKey(), toJson(field.getValue()));
        }
        return node;
    }
}
