package io.avroxform.standalone.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration for the standalone runner.
 *
 * <p>
 * The transform itself is described by a flat plugin property map (the same keys a host passes to
 * {@code TransformPlugin.init}); the remaining fields configure the runner around it. Use {@link
 * #builder()} to construct instances.
 *
 * @param properties    plugin properties, e.g. {@code schema_url}, {@code dynamic_csv},
 *                      {@code value_1}
 * @param workers       size of the payload worker pool
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record StandaloneConfig(
        Map<String, String> properties, int workers, String loggingFormat, String loggingLevel) {

    public static final int DEFAULT_WORKERS = 4;
    public static final String DEFAULT_LOGGING_FORMAT = "text";
    public static final String DEFAULT_LOGGING_LEVEL = "INFO";

    public StandaloneConfig {
        Objects.requireNonNull(properties, "properties must not be null");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
    }

    /** Creates a new builder with defaults applied. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link StandaloneConfig}. */
    public static final class Builder {
        private final Map<String, String> properties = new LinkedHashMap<>();
        private int workers = DEFAULT_WORKERS;
        private String loggingFormat = DEFAULT_LOGGING_FORMAT;
        private String loggingLevel = DEFAULT_LOGGING_LEVEL;

        Builder() {}

        /** Sets one plugin property, replacing any earlier value. */
        public Builder property(String key, String value) {
            properties.put(key, value);
            return this;
        }

        /** Removes a plugin property. */
        public Builder removeProperty(String key) {
            properties.remove(key);
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public StandaloneConfig build() {
            return new StandaloneConfig(properties, workers, loggingFormat, loggingLevel);
        }
    }
}
