package io.avroxform.core.error;

/**
 * Thrown when a decoded value does not have the tag its column or field requires. URN:
 * {@code urn:avro-xform:error:type-mismatch}
 */
public final class TypeMismatchException extends TransformEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:avro-xform:error:type-mismatch";

    public TypeMismatchException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, recordIndex);
    }

    public TypeMismatchException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, recordIndex);
    }

    @Override
    public String urn() {
        return URN;
    }
}
