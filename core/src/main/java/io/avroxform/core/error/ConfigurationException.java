package io.avroxform.core.error;

/** Thrown when plugin properties are missing, malformed or contradictory. */
public final class ConfigurationException extends TransformLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message, String instanceName, String source) {
        super(message, instanceName, source);
    }

    public ConfigurationException(String message, Throwable cause, String instanceName, String source) {
        super(message, cause, instanceName, source);
    }
}
