package io.avroxform.core.engine;

import io.avroxform.core.engine.RecordDecoder.DecodeResult;
import io.avroxform.core.engine.SchemaCache.Lookup;
import io.avroxform.core.engine.avro.AvroRecordCodec;
import io.avroxform.core.engine.registry.HttpSchemaRegistryClient;
import io.avroxform.core.error.ConfigurationException;
import io.avroxform.core.error.SchemaCompileException;
import io.avroxform.core.error.TransformEvalException;
import io.avroxform.core.model.EngineConfig;
import io.avroxform.core.model.ExtractionMode;
import io.avroxform.core.model.Frame;
import io.avroxform.core.model.TransformResult;
import io.avroxform.core.model.Value;
import io.avroxform.core.spi.CompiledSchema;
import io.avroxform.core.spi.RecordCodec;
import io.avroxform.core.spi.SchemaRegistryClient;
import io.avroxform.core.spi.TelemetryListener;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Core transformation engine. Turns one payload of framed (or unframed) binary records into
 * comma-delimited rows.
 *
 * <p>
 * Per invocation: {@link FrameParser} → schema resolution (embedded schema, or {@link
 * SchemaCache} backed by the registry) → {@link RecordDecoder} → row extraction (static layout or
 * {@link PathResolver} + {@link FieldFormatter} per column) → {@link CsvEmitter}. Any per-invocation
 * error yields an ERROR result with no output; rows decoded before the failure are discarded.
 *
 * <p>
 * An engine is only ever observable in its ready state: construction validates the configuration
 * and compiles an embedded schema, and throws {@link ConfigurationException} otherwise.
 *
 * <p>
 * Thread-safe: configuration, extractor and formatter are immutable; the schema cache and the
 * compiled-schema memo are concurrent maps. One instance is shared by all invocations.
 */
public final class TransformEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TransformEngine.class);

    /** MDC key carrying the instance name while an invocation runs. */
    public static final String MDC_NAME = "xform.name";

    private final EngineConfig config;
    private final RecordDecoder decoder;
    private final SchemaCache schemaCache;
    private final CompiledSchema embeddedSchema;
    private final RowExtractor extractor;
    private final TelemetryListener telemetryListener;

    /**
     * Creates an engine with the Avro codec and an HTTP registry client built from the
     * configuration.
     *
     * @param config the validated configuration
     * @throws ConfigurationException if an embedded schema cannot be compiled
     */
    public static TransformEngine create(EngineConfig config) {
        return create(config, null);
    }

    /**
     * Same as {@link #create(EngineConfig)} with an optional telemetry listener.
     *
     * @param telemetryListener listener for invocation events, may be null
     */
    public static TransformEngine create(EngineConfig config, TelemetryListener telemetryListener) {
        Objects.requireNonNull(config, "config must not be null");
        SchemaRegistryClient registryClient = config.embeddedSchema()
                ? null
                : new HttpSchemaRegistryClient(
                        config.registryUrl(),
                        config.registryConnectTimeoutMs(),
                        config.registryTimeoutMs(),
                        config.name());
        return new TransformEngine(config, new AvroRecordCodec(), registryClient, telemetryListener);
    }

    /**
     * Creates an engine with explicit collaborators.
     *
     * @param config            the validated configuration
     * @param codec             decodes records for a schema
     * @param registryClient    fetches schemas by id; required when the configuration has no
     *                          embedded schema, ignored otherwise
     * @param telemetryListener optional listener for invocation events, may be null
     * @throws ConfigurationException if an embedded schema cannot be compiled or a registry client
     *                                is required but missing
     */
    public TransformEngine(
            EngineConfig config,
            RecordCodec codec,
            SchemaRegistryClient registryClient,
            TelemetryListener telemetryListener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.decoder = new RecordDecoder(Objects.requireNonNull(codec, "codec must not be null"));
        this.telemetryListener = telemetryListener; // nullable

        if (config.embeddedSchema()) {
            try {
                this.embeddedSchema = decoder.compile(config.schemaText());
            } catch (SchemaCompileException e) {
                throw new ConfigurationException(
                        "embedded schema is invalid: " + e.getMessage(), e, config.name(), "schema_file");
            }
            this.schemaCache = null;
        } else {
            if (registryClient == null) {
                throw new ConfigurationException(
                        "registry mode requires a schema registry client", config.name(), "schema_url");
            }
            this.embeddedSchema = null;
            this.schemaCache = new SchemaCache(registryClient);
        }

        FieldFormatter formatter = new FieldFormatter(config.zoneId());
        this.extractor = config.mode() == ExtractionMode.DYNAMIC
                ? new DynamicRowExtractor(config.columns(), formatter, config.name())
                : new StaticRowExtractor(formatter, config.name());

        LOG.info(
                "Transform engine ready: name={}, schema_source={}, mode={}, columns={}",
                config.name(),
                config.embeddedSchema() ? "embedded" : config.registryUrl(),
                config.mode(),
                config.columns().size());
    }

    /** The configuration this engine was built from. */
    public EngineConfig config() {
        return config;
    }

    /**
     * Transforms one payload.
     *
     * @param payload the raw invocation input
     * @return SUCCESS with one row per decoded record, or ERROR with no output
     */
    public TransformResult transform(byte[] payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        long startNanos = System.nanoTime();
        String previousName = MDC.get(MDC_NAME);
        if (config.name() != null) {
            MDC.put(MDC_NAME, config.name());
        }
        try {
            LOG.debug("Start transform: name={}, input_bytes={}", config.name(), payload.length);
            TransformResult result = transformInternal(payload);
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.info(
                    "Transform completed: name={}, rows={}, output_bytes={}, duration_ms={}",
                    config.name(),
                    result.rowCount(),
                    result.output().length,
                    durationMs);
            notifyListener(l -> l.onTransformCompleted(
                    new TelemetryListener.TransformCompletedEvent(config.name(), result.rowCount(), durationMs)));
            return result;
        } catch (TransformEvalException e) {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.warn(
                    "Transform failed: name={}, phase={}, code={}, detail={}",
                    config.name(),
                    e.phase(),
                    e.urn(),
                    e.getMessage());
            notifyListener(l -> l.onTransformFailed(new TelemetryListener.TransformFailedEvent(
                    config.name(), e.urn(), e.getMessage(), durationMs)));
            return TransformResult.error(e);
        } finally {
            if (previousName != null) {
                MDC.put(MDC_NAME, previousName);
            } else {
                MDC.remove(MDC_NAME);
            }
        }
    }

    private TransformResult transformInternal(byte[] payload) {
        Frame frame = FrameParser.parse(payload, config.embeddedSchema(), config.name());
        CompiledSchema schema = frame.hasSchemaId() ? resolveSchema(frame.schemaId()) : embeddedSchema;

        DecodeResult decoded = decoder.decodeAll(schema, frame.records(), frame.offset());
        notifyListener(l -> l.onDecodeStopped(new TelemetryListener.DecodeStoppedEvent(
                config.name(), decoded.records().size(), decoded.trailingBytes(), decoded.termination())));

        CsvEmitter emitter = new CsvEmitter();
        List<Value> records = decoded.records();
        for (int i = 0; i < records.size(); i++) {
            emitter.emit(extractor.extract(records.get(i), i));
        }
        return TransformResult.success(emitter.toByteArray(), emitter.rowCount());
    }

    private CompiledSchema resolveSchema(int schemaId) {
        Lookup lookup = schemaCache.lookup(schemaId);
        notifyListener(l -> l.onSchemaResolved(
                new TelemetryListener.SchemaResolvedEvent(config.name(), schemaId, lookup.cacheHit())));
        try {
            return decoder.compile(lookup.schemaText());
        } catch (SchemaCompileException e) {
            throw new SchemaCompileException(
                    "schema id " + schemaId + ": " + e.getMessage(), e.getCause(), config.name(), null);
        }
    }

    /** Notifies the telemetry listener; listener exceptions are logged and never propagated. */
    private void notifyListener(Consumer<TelemetryListener> action) {
        if (telemetryListener == null) {
            return;
        }
        try {
            action.accept(telemetryListener);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry listener threw exception (ignored): {}", e.getMessage(), e);
        }
    }
}
