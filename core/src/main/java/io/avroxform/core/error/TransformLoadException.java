package io.avroxform.core.error;

/**
 * Abstract parent for construction-time configuration errors. Thrown while a {@code
 * TransformPlugin} is initialized; an engine is never built when one of these escapes. Carries a
 * {@code source} field naming the property or file that caused the error.
 */
public abstract class TransformLoadException extends TransformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected TransformLoadException(String message, String instanceName, String source) {
        super(message, instanceName, Phase.INIT);
        this.source = source;
    }

    protected TransformLoadException(String message, Throwable cause, String instanceName, String source) {
        super(message, cause, instanceName, Phase.INIT);
        this.source = source;
    }

    /** The property key or file path that caused the error. */
    public String source() {
        return source;
    }
}
