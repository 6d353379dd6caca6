package io.avroxform.core.error;

/**
 * Signals that a {@link io.avroxform.core.spi.CompiledSchema} could not decode a record at the
 * requested offset. The decode loop treats this as the end of the record stream; it never reaches
 * a caller of the engine.
 */
public class RecordDecodeException extends Exception {

    private static final long serialVersionUID = 1L;

    public RecordDecodeException(String message) {
        super(message);
    }

    public RecordDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
