package io.avroxform.core.engine;

import io.avroxform.core.error.ConfigurationException;
import io.avroxform.core.error.InvocationOrderingException;
import io.avroxform.core.model.EngineConfig;
import io.avroxform.core.model.TransformResult;
import io.avroxform.core.spec.ConfigParser;
import io.avroxform.core.spi.TelemetryListener;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host-facing lifecycle wrapper around a {@link TransformEngine}.
 *
 * <p>
 * States: UNINITIALIZED → READY. {@link #init(Map)} parses the plugin properties and builds the
 * engine; a failure leaves the plugin UNINITIALIZED so the host may retry with corrected
 * properties. Once READY the plugin never goes back. {@link #transform(byte[])} before a
 * successful init returns an {@link InvocationOrderingException} result instead of throwing.
 *
 * <p>
 * Thread-safe: inits are serialized, so only the first successful one builds an engine (and its
 * registry client); later ones fail without constructing anything. Transforms read the published
 * engine through an {@link AtomicReference} without locking.
 */
public final class TransformPlugin {

    private static final Logger LOG = LoggerFactory.getLogger(TransformPlugin.class);

    private final Function<EngineConfig, TransformEngine> engineFactory;
    private final AtomicReference<TransformEngine> engineRef = new AtomicReference<>();
    private final Object initLock = new Object();

    /** Creates a plugin that builds engines with the Avro codec and HTTP registry client. */
    public TransformPlugin() {
        this((TelemetryListener) null);
    }

    /**
     * Creates a plugin whose engine reports to the given listener.
     *
     * @param telemetryListener listener for invocation events, may be null
     */
    public TransformPlugin(TelemetryListener telemetryListener) {
        this(config -> TransformEngine.create(config, telemetryListener));
    }

    /**
     * Creates a plugin with a custom engine factory.
     *
     * @param engineFactory builds the engine from the parsed configuration
     */
    public TransformPlugin(Function<EngineConfig, TransformEngine> engineFactory) {
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory must not be null");
    }

    /**
     * Parses the properties and builds the engine.
     *
     * @param properties plugin properties as supplied by the host
     * @throws ConfigurationException if the properties are invalid, the embedded schema does not
     *                                compile, or the plugin is already initialized
     */
    public void init(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        synchronized (initLock) {
            TransformEngine current = engineRef.get();
            if (current != null) {
                throw alreadyInitialized(current);
            }
            EngineConfig config = ConfigParser.parse(properties);
            engineRef.set(engineFactory.apply(config));
            LOG.info("Plugin initialized: name={}", config.name());
        }
    }

    /**
     * Transforms one payload with the initialized engine.
     *
     * @return the engine's result, or an ERROR result when the plugin is not initialized
     */
    public TransformResult transform(byte[] payload) {
        TransformEngine engine = engineRef.get();
        if (engine == null) {
            LOG.warn("Transform called before init");
            return TransformResult.error(
                    new InvocationOrderingException("transform called before init", null, null));
        }
        return engine.transform(payload);
    }

    /** True once {@link #init(Map)} has succeeded. */
    public boolean isReady() {
        return engineRef.get() != null;
    }

    /** The engine, or {@code null} while UNINITIALIZED. */
    public TransformEngine engine() {
        return engineRef.get();
    }

    private static ConfigurationException alreadyInitialized(TransformEngine engine) {
        String name = engine.config().name();
        return new ConfigurationException("plugin '" + name + "' is already initialized", name, null);
    }
}
