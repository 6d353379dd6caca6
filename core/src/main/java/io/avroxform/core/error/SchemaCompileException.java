package io.avroxform.core.error;

/**
 * Thrown when schema text cannot be compiled by the record codec. URN:
 * {@code urn:avro-xform:error:schema-invalid}
 */
public final class SchemaCompileException extends TransformEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:avro-xform:error:schema-invalid";

    public SchemaCompileException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, recordIndex);
    }

    public SchemaCompileException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, recordIndex);
    }

    @Override
    public String urn() {
        return URN;
    }
}
