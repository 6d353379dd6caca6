package io.avroxform.core.error;

/**
 * Thrown when the schema registry answers with a non-200 status or cannot be reached. URN:
 * {@code urn:avro-xform:error:registry-unavailable}
 */
public final class RegistryException extends TransformEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:avro-xform:error:registry-unavailable";

    public RegistryException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, recordIndex);
    }

    public RegistryException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, recordIndex);
    }

    @Override
    public String urn() {
        return URN;
    }
}
