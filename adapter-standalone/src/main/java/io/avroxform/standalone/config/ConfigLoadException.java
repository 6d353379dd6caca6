package io.avroxform.standalone.config;

/**
 * Thrown when the runner configuration cannot be loaded: missing file, invalid YAML or a value of
 * the wrong shape. The message is meant for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
