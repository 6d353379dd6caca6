package io.avroxform.core.spi;

import io.avroxform.core.error.RecordDecodeException;
import io.avroxform.core.model.Value;

/**
 * An immutable, thread-safe compiled schema handle produced by {@link RecordCodec#compile(String)}.
 *
 * <p>Implementations MUST be thread-safe: a single handle is shared across concurrent
 * invocations.
 */
public interface CompiledSchema {

    /**
     * Decodes one record starting at {@code offset}.
     *
     * @param buffer bytes holding back-to-back encoded records
     * @param offset index of the first unread byte
     * @return the decoded value and the offset just past it
     * @throws RecordDecodeException if no complete, valid record starts at {@code offset}
     */
    DecodedRecord decodeOne(byte[] buffer, int offset) throws RecordDecodeException;

    /**
     * Result of a single successful decode.
     *
     * @param value      the decoded record
     * @param nextOffset offset of the first byte after the record
     */
    record DecodedRecord(Value value, int nextOffset) {}
}
