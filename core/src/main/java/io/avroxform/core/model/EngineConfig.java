package io.avroxform.core.model;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable engine configuration, produced once by {@link io.avroxform.core.spec.ConfigParser}
 * and shared read-only by every invocation.
 *
 * <p>
 * Exactly one of {@code schemaText} and {@code registryUrl} is set. When {@code schemaText} is
 * set, payloads are unframed record streams; otherwise each payload carries a frame header whose
 * schema id is resolved against the registry.
 *
 * @param name                     instance name used in diagnostics
 * @param schemaText               embedded schema text, or {@code null} in registry mode
 * @param registryUrl              registry base URL, or {@code null} in embedded mode
 * @param mode                     static or dynamic row extraction
 * @param columns                  dynamic column layout; empty in static mode
 * @param zoneId                   zone used to render timestamp columns
 * @param registryConnectTimeoutMs TCP connect timeout for registry calls
 * @param registryTimeoutMs        overall request timeout for registry calls
 */
public record EngineConfig(
        String name,
        String schemaText,
        String registryUrl,
        ExtractionMode mode,
        ColumnSpec columns,
        ZoneId zoneId,
        int registryConnectTimeoutMs,
        int registryTimeoutMs) {

    public static final int DEFAULT_REGISTRY_CONNECT_TIMEOUT_MS = 5000;
    public static final int DEFAULT_REGISTRY_TIMEOUT_MS = 10000;

    public EngineConfig {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(zoneId, "zoneId must not be null");
        if ((schemaText == null) == (registryUrl == null)) {
            throw new IllegalArgumentException("exactly one of schemaText and registryUrl must be set");
        }
        if (mode == ExtractionMode.DYNAMIC && columns.size() == 0) {
            throw new IllegalArgumentException("dynamic mode requires at least one column");
        }
        if (registryConnectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                    "registryConnectTimeoutMs must be positive, got: " + registryConnectTimeoutMs);
        }
        if (registryTimeoutMs <= 0) {
            throw new IllegalArgumentException("registryTimeoutMs must be positive, got: " + registryTimeoutMs);
        }
    }

    /** True when payloads carry no frame header. */
    public boolean embeddedSchema() {
        return schemaText != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EngineConfig}. Defaults: static mode, system zone, default timeouts. */
    public static final class Builder {
        private String name;
        private String schemaText;
        private String registryUrl;
        private ExtractionMode mode = ExtractionMode.STATIC;
        private ColumnSpec columns = ColumnSpec.empty();
        private ZoneId zoneId = ZoneId.systemDefault();
        private int registryConnectTimeoutMs = DEFAULT_REGISTRY_CONNECT_TIMEOUT_MS;
        private int registryTimeoutMs = DEFAULT_REGISTRY_TIMEOUT_MS;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schemaText(String schemaText) {
            this.schemaText = schemaText;
            return this;
        }

        public Builder registryUrl(String registryUrl) {
            this.registryUrl = registryUrl;
            return this;
        }

        public Builder mode(ExtractionMode mode) {
            this.mode = mode;
            return this;
        }

        /** Sets the columns and switches to {@link ExtractionMode#DYNAMIC}. */
        public Builder dynamicColumns(ColumnSpec columns) {
            this.columns = columns;
            this.mode = ExtractionMode.DYNAMIC;
            return this;
        }

        public Builder zoneId(ZoneId zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        public Builder registryConnectTimeoutMs(int registryConnectTimeoutMs) {
            this.registryConnectTimeoutMs = registryConnectTimeoutMs;
            return this;
        }

        public Builder registryTimeoutMs(int registryTimeoutMs) {
            this.registryTimeoutMs = registryTimeoutMs;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(
                    name,
                    schemaText,
                    registryUrl,
                    mode,
                    columns,
                    zoneId,
                    registryConnectTimeoutMs,
                    registryTimeoutMs);
        }
    }
}
