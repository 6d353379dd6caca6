package io.avroxform.core.engine.avro;

import io.avroxform.core.error.RecordDecodeException;
import io.avroxform.core.error.SchemaCompileException;
import io.avroxform.core.model.Value;
import io.avroxform.core.spi.CompiledSchema;
import io.avroxform.core.spi.RecordCodec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.IndexedRecord;

/**
 * Apache Avro record codec. Decodes Avro binary encoding (no container file, no per-record
 * framing) with the generic data model and converts the result into {@link Value} trees.
 *
 * <p>Records are decoded through a direct (unbuffered) binary decoder so that the number of bytes
 * consumed by one record is exact and the next record starts right after it. Length prefixes and
 * collection counts are bounded by the bytes left in the buffer, so corrupt trailing bytes end the
 * read with a decode failure rather than a large allocation.
 *
 * <p>Type mapping: {@code record}/{@code map} → object, {@code array} → array, {@code
 * int}/{@code long} → integer, {@code float}/{@code double} → floating, {@code string}/{@code
 * enum} → text, {@code bytes}/{@code fixed} → bytes, {@code null} → null. Unions decode to the
 * selected branch.
 */
public final class AvroRecordCodec implements RecordCodec {

    /** Codec identifier. */
    public static final String CODEC_ID = "avro";

    @Override
    public String id() {
        return CODEC_ID;
    }

    @Override
    public CompiledSchema compile(String schemaText) {
        try {
            Schema schema = new Schema.Parser().parse(schemaText);
            return new AvroCompiledSchema(schema);
        } catch (AvroRuntimeException e) {
            throw new SchemaCompileException("Failed to parse Avro schema: " + e.getMessage(), e, null, null);
        }
    }

    /** Thread-safe compiled Avro schema handle; readers are kept per thread. */
    private static final class AvroCompiledSchema implements CompiledSchema {

        private final Schema schema;
        private final ThreadLocal<BoundedDatumReader> readers;

        AvroCompiledSchema(Schema schema) {
            this.schema = schema;
            this.readers = ThreadLocal.withInitial(() -> new BoundedDatumReader(schema));
        }

        @Override
        public DecodedRecord decodeOne(byte[] buffer, int offset) throws RecordDecodeException {
            BoundedDecoder decoder = new BoundedDecoder(buffer, offset);
            Object datum;
            try {
                datum = readers.get().read(decoder);
            } catch (IOException | RuntimeException e) {
                throw new RecordDecodeException(
                        "Avro decode of " + schema.getFullName() + " failed at offset " + offset + ": " + e, e);
            }
            return new DecodedRecord(toValue(datum), offset + decoder.consumed());
        }
    }

    /**
     * Generic reader whose array and map capacities never exceed the bytes left in the buffer. The
     * block count is still honoured; collections grow past the hint only as elements are read.
     */
    private static final class BoundedDatumReader extends GenericDatumReader<Object> {

        private BoundedDecoder current;

        BoundedDatumReader(Schema schema) {
            super(schema);
        }

        Object read(BoundedDecoder decoder) throws IOException {
            current = decoder;
            try {
                return read(null, decoder);
            } finally {
                current = null;
            }
        }

        private int capacity(int size) {
            return current == null ? size : Math.max(0, Math.min(size, current.remaining()));
        }

        @Override
        protected Object newArray(Object old, int size, Schema schema) {
            return super.newArray(old, capacity(size), schema);
        }

        @Override
        protected Object newMap(Object old, int size) {
            return super.newMap(old, capacity(size));
        }
    }

    /** Converts a generic Avro datum into a {@link Value} tree. */
    static Value toValue(Object datum) {
        if (datum == null) {
            return Value.nil();
        }
        if (datum instanceof Boolean b) {
            return Value.of(b.booleanValue());
        }
        if (datum instanceof Integer || datum instanceof Long) {
            return Value.of(((Number) datum).longValue());
        }
        if (datum instanceof Float f) {
            // widen through the decimal form so 0.1f stays 0.1
            return Value.of(Double.parseDouble(Float.toString(f)));
        }
        if (datum instanceof Double d) {
            return Value.of(d.doubleValue());
        }
        if (datum instanceof CharSequence text) {
            return Value.of(text.toString());
        }
        if (datum instanceof ByteBuffer bytes) {
            ByteBuffer view = bytes.duplicate();
            byte[] copy = new byte[view.remaining()];
            view.get(copy);
            return Value.ofBytes(copy);
        }
        if (datum instanceof GenericFixed fixed) {
            return Value.ofBytes(fixed.bytes().clone());
        }
        if (datum instanceof GenericEnumSymbol<?> symbol) {
            return Value.of(symbol.toString());
        }
        if (datum instanceof IndexedRecord record) {
            Map<String, Value> fields = new LinkedHashMap<>();
            for (Schema.Field field : record.getSchema().getFields()) {
                fields.put(field.name(), toValue(record.get(field.pos())));
            }
            return Value.object(fields);
        }
        if (datum instanceof Map<?, ?> map) {
            Map<String, Value> fields = new LinkedHashMap<>();
            map.forEach((key, value) -> fields.put(String.valueOf(key), toValue(value)));
            return Value.object(fields);
        }
        if (datum instanceof Collection<?> collection) {
            List<Value> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(toValue(element));
            }
            return Value.array(elements);
        }
        return Value.of(datum.toString());
    }
}
