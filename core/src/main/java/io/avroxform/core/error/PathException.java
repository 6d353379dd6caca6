package io.avroxform.core.error;

/**
 * Thrown when a path expression cannot be resolved (missing key, index out of range, or a
 * segment applied to a value of the wrong kind). URN:
 * {@code urn:avro-xform:error:path-unresolved}
 */
public final class PathException extends TransformEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:avro-xform:error:path-unresolved";

    public PathException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, recordIndex);
    }

    public PathException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, recordIndex);
    }

    @Override
    public String urn() {
        return URN;
    }
}
