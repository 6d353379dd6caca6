package io.avroxform.core.error;

/**
 * Abstract parent for per-invocation errors. Thrown inside {@code TransformEngine.transform()};
 * the engine catches these and turns them into an error {@code TransformResult} with no output.
 * Carries the index of the record being processed, if any; the phase follows from it.
 */
public abstract class TransformEvalException extends TransformException {

    private static final long serialVersionUID = 1L;

    private final Integer recordIndex;

    protected TransformEvalException(String message, String instanceName, Integer recordIndex) {
        super(message, instanceName, phaseOf(recordIndex));
        this.recordIndex = recordIndex;
    }

    protected TransformEvalException(String message, Throwable cause, String instanceName, Integer recordIndex) {
        super(message, cause, instanceName, phaseOf(recordIndex));
        this.recordIndex = recordIndex;
    }

    private static Phase phaseOf(Integer recordIndex) {
        return recordIndex == null ? Phase.INVOCATION : Phase.RECORD;
    }

    /** Zero-based index of the decoded record that failed, or {@code null} before decoding. */
    public Integer recordIndex() {
        return recordIndex;
    }

    /** Error code reported on the failed result. */
    public abstract String urn();
}
