package io.avroxform.core.error;

/**
 * Thrown when a payload is submitted to a plugin that has not completed initialization. URN:
 * {@code urn:avro-xform:error:invocation-ordering}
 */
public final class InvocationOrderingException extends TransformEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:avro-xform:error:invocation-ordering";

    public InvocationOrderingException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, recordIndex);
    }

    public InvocationOrderingException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, recordIndex);
    }

    @Override
    public String urn() {
        return URN;
    }
}
