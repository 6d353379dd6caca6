package io.avroxform.core.engine;

import io.avroxform.core.error.FramingException;
import io.avroxform.core.model.Frame;
import java.util.Objects;

/**
 * Splits a payload into its schema id and record stream.
 *
 * <p>
 * Registry-mode wire layout: byte 0 is the magic marker {@code 0x00}, bytes 1–4 hold a big-endian
 * signed 32-bit schema id, and every byte after that belongs to the record stream. With an
 * embedded schema there is no header and the whole payload is the record stream.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class FrameParser {

    /** Value of the first header byte. */
    public static final byte MAGIC_BYTE = 0;

    /** Magic byte plus the 4-byte schema id. */
    public static final int HEADER_LENGTH = 5;

    private FrameParser() {}

    /**
     * Parses the payload.
     *
     * @param payload        the raw invocation input
     * @param embeddedSchema true when the engine has a static schema and payloads are unframed
     * @param instanceName   instance name for error reporting, may be null
     * @return the parsed frame
     * @throws FramingException if a framed payload is shorter than the header or has a bad magic
     *                          byte
     */
    public static Frame parse(byte[] payload, boolean embeddedSchema, String instanceName) {
        Objects.requireNonNull(payload, "payload must not be null");
        if (embeddedSchema) {
            return new Frame(null, payload, 0);
        }
        if (payload.length == 0) {
            throw new FramingException("truncated frame header: payload is empty", instanceName, null);
        }
        if (payload[0] != MAGIC_BYTE) {
            throw new FramingException(
                    "bad magic byte: " + (payload[0] & 0xFF) + ", should be " + MAGIC_BYTE, instanceName, null);
        }
        if (payload.length < HEADER_LENGTH) {
            throw new FramingException(
                    "truncated frame header: expected " + HEADER_LENGTH + " bytes, got " + payload.length,
                    instanceName,
                    null);
        }
        return new Frame(readSchemaId(payload), payload, HEADER_LENGTH);
    }

    private static int readSchemaId(byte[] payload) {
        return ((payload[1] & 0xFF) << 24)
                | ((payload[2] & 0xFF) << 16)
                | ((payload[3] & 0xFF) << 8)
                | (payload[4] & 0xFF);
    }
}
