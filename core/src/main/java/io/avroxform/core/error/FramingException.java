package io.avroxform.core.error;

/**
 * Thrown when a registry-mode payload lacks a valid header (bad magic byte, truncated id). URN:
 * {@code urn:avro-xform:error:bad-frame}
 */
public final class FramingException extends TransformEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:avro-xform:error:bad-frame";

    public FramingException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, recordIndex);
    }

    public FramingException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, recordIndex);
    }

    @Override
    public String urn() {
        return URN;
    }
}
