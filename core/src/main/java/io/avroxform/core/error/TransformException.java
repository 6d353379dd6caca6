package io.avroxform.core.error;

/**
 * Abstract base for all avro-xform exceptions. Never thrown directly.
 *
 * <p>
 * Errors split by when they can happen. {@link TransformLoadException}s come out of plugin
 * initialization and mean no engine exists. {@link TransformEvalException}s happen inside one
 * invocation and are reported on that invocation's result; they are tied to a single record once
 * decoding has produced one.
 */
public abstract class TransformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** When the error occurred. */
    public enum Phase {
        /** While parsing properties or building the engine. */
        INIT,
        /** During an invocation, before any record was attributed: framing, registry, schema. */
        INVOCATION,
        /** While extracting a row from one decoded record. */
        RECORD
    }

    private final String instanceName;
    private final Phase phase;

    protected TransformException(String message, String instanceName, Phase phase) {
        super(message);
        this.instanceName = instanceName;
        this.phase = phase;
    }

    protected TransformException(String message, Throwable cause, String instanceName, Phase phase) {
        super(message, cause);
        this.instanceName = instanceName;
        this.phase = phase;
    }

    /** The configured {@code name} of the transform instance, or {@code null} if not yet known. */
    public String instanceName() {
        return instanceName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** When the error occurred. */
    public Phase phase() {
        return phase;
    }
}
