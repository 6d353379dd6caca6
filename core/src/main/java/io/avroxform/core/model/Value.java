package io.avroxform.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded datum. Every record produced by a {@link io.avroxform.core.spi.RecordCodec} and every
 * sub-structure inside it is one of the variants below.
 *
 * <p>
 * Implementations are a sealed hierarchy, so callers can branch exhaustively over the tag set
 * instead of casting. Composite values hold immutable copies of their children.
 *
 * <p>
 * Thread-safe and immutable (apart from the byte array exposed by {@link BytesValue#bytes()},
 * which callers must not modify).
 */
public sealed interface Value {

    /** The tag of a value, used in diagnostics. */
    enum Tag {
        NULL,
        BOOL,
        INT,
        FLOAT,
        BYTES,
        TEXT,
        ARRAY,
        OBJECT
    }

    Tag tag();

    // ── Factories ──

    static Value nil() {
        return NullValue.INSTANCE;
    }

    static Value of(boolean value) {
        return new BoolValue(value);
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(String value) {
        return value == null ? NullValue.INSTANCE : new TextValue(value);
    }

    static Value ofBytes(byte[] value) {
        return value == null ? NullValue.INSTANCE : new BytesValue(value);
    }

    static Value array(List<Value> elements) {
        return new ArrayValue(elements);
    }

    static Value array(Value... elements) {
        return new ArrayValue(Arrays.asList(elements));
    }

    static Value object(Map<String, Value> fields) {
        return new ObjectValue(fields);
    }

    // ── Variants ──

    /** Absent value (Avro {@code null}). */
    record NullValue() implements Value {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public Tag tag() {
            return Tag.NULL;
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public Tag tag() {
            return Tag.BOOL;
        }
    }

    /** Integer value; Avro {@code int} and {@code long} both widen to 64 bits. */
    record IntValue(long value) implements Value {
        @Override
        public Tag tag() {
            return Tag.INT;
        }
    }

    /** Floating value; Avro {@code float} and {@code double} both widen to 64 bits. */
    record FloatValue(double value) implements Value {
        @Override
        public Tag tag() {
            return Tag.FLOAT;
        }
    }

    /**
     * Raw byte sequence (Avro {@code bytes} and {@code fixed}).
     *
     * <p>
     * Overrides {@code equals}/{@code hashCode} to compare content, since records use reference
     * equality for arrays.
     */
    record BytesValue(byte[] bytes) implements Value {
        public BytesValue {
            Objects.requireNonNull(bytes, "bytes must not be null");
        }

        @Override
        public Tag tag() {
            return Tag.BYTES;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BytesValue that)) return false;
            return Arrays.equals(bytes, that.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "BytesValue" + Arrays.toString(bytes);
        }
    }

    /** Text value (Avro {@code string} and {@code enum} symbols). */
    record TextValue(String value) implements Value {
        public TextValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Tag tag() {
            return Tag.TEXT;
        }
    }

    /** Ordered sequence of values. */
    record ArrayValue(List<Value> elements) implements Value {
        public ArrayValue {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        @Override
        public Tag tag() {
            return Tag.ARRAY;
        }
    }

    /** Mapping from field name to value (Avro {@code record} and {@code map}). */
    record ObjectValue(Map<String, Value> fields) implements Value {
        public ObjectValue {
            Objects.requireNonNull(fields, "fields must not be null");
            // keeps decode order for rendering; lookups never depend on it
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        /** Returns the named field, or {@code null} when absent. */
        public Value get(String key) {
            return fields.get(key);
        }

        @Override
        public Tag tag() {
            return Tag.OBJECT;
        }
    }
}
