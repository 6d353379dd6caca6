package io.avroxform.core.engine;

import io.avroxform.core.error.RecordDecodeException;
import io.avroxform.core.model.DecodeTermination;
import io.avroxform.core.model.Value;
import io.avroxform.core.spi.CompiledSchema;
import io.avroxform.core.spi.CompiledSchema.DecodedRecord;
import io.avroxform.core.spi.RecordCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes a record stream into a list of decoded records.
 *
 * <p>
 * The stream has no length prefixes: record boundaries are found only by decoding. The loop
 * stops when the buffer is exhausted or when the codec rejects the bytes at the current offset.
 * A rejection is not an error; the undecodable tail is dropped and the records decoded so far are
 * returned. Clean end of stream and corrupt trailing bytes are therefore indistinguishable to the
 * caller, but {@link DecodeResult#termination()} and {@link DecodeResult#trailingBytes()} record
 * which case occurred.
 *
 * <p>
 * Compiled schemas are memoised by schema text. Thread-safe.
 */
public final class RecordDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(RecordDecoder.class);

    private final RecordCodec codec;
    private final Map<String, CompiledSchema> compiled = new ConcurrentHashMap<>();

    public RecordDecoder(RecordCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Compiles (or returns the memoised) schema for the given text.
     *
     * @throws io.avroxform.core.error.SchemaCompileException if the text is not a valid schema
     */
    public CompiledSchema compile(String schemaText) {
        Objects.requireNonNull(schemaText, "schemaText must not be null");
        CompiledSchema schema = compiled.get(schemaText);
        if (schema == null) {
            schema = codec.compile(schemaText);
            compiled.put(schemaText, schema);
        }
        return schema;
    }

    /** Decodes every record in {@code buffer}, compiling {@code schemaText} first. */
    public DecodeResult decodeAll(String schemaText, byte[] buffer) {
        return decodeAll(compile(schemaText), buffer, 0);
    }

    /**
     * Decodes records from {@code buffer[offset..]} until the buffer is exhausted or a decode
     * fails.
     */
    public DecodeResult decodeAll(CompiledSchema schema, byte[] buffer, int offset) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(buffer, "buffer must not be null");

        List<Value> records = new ArrayList<>();
        int position = offset;
        while (position < buffer.length) {
            DecodedRecord decoded;
            try {
                decoded = schema.decodeOne(buffer, position);
            } catch (RecordDecodeException e) {
                LOG.debug(
                        "Stop decode: records={}, trailing_bytes={}, reason={}",
                        records.size(),
                        buffer.length - position,
                        e.getMessage());
                return new DecodeResult(records, buffer.length - position, DecodeTermination.DECODE_FAILURE);
            }
            if (decoded.nextOffset() <= position) {
                LOG.debug(
                        "Stop decode: codec consumed no bytes at offset {}, trailing_bytes={}",
                        position,
                        buffer.length - position);
                return new DecodeResult(records, buffer.length - position, DecodeTermination.NO_PROGRESS);
            }
            records.add(decoded.value());
            position = decoded.nextOffset();
        }
        return new DecodeResult(records, 0, DecodeTermination.END_OF_STREAM);
    }

    /**
     * Records decoded from one buffer.
     *
     * @param records       decoded records in stream order
     * @param trailingBytes bytes left undecoded when the loop stopped
     * @param termination   why the loop stopped
     */
    public record DecodeResult(List<Value> records, int trailingBytes, DecodeTermination termination) {
        public DecodeResult {
            records = List.copyOf(records);
        }
    }
}
