package io.avroxform.core.spi;

import io.avroxform.core.model.DecodeTermination;

/**
 * SPI for observability hooks.
 *
 * <p>
 * Hosts provide concrete implementations that bridge to their metrics system. The core has no
 * telemetry dependencies.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the engine and logged; they never
 * affect the transform outcome.
 */
public interface TelemetryListener {

    /** Called when an invocation produced output. */
    void onTransformCompleted(TransformCompletedEvent event);

    /** Called when an invocation failed and produced no output. */
    void onTransformFailed(TransformFailedEvent event);

    /** Called when a frame's schema id has been resolved, from cache or registry. */
    void onSchemaResolved(SchemaResolvedEvent event);

    /**
     * Called when the decode loop stops. This is the only place where trailing bytes dropped after
     * a decode failure become visible.
     */
    void onDecodeStopped(DecodeStoppedEvent event);

    // --- Event records ---

    /** Event emitted when an invocation completes successfully. */
    record TransformCompletedEvent(String instanceName, int rowCount, long durationMs) {}

    /** Event emitted when an invocation fails. */
    record TransformFailedEvent(String instanceName, String errorCode, String errorDetail, long durationMs) {}

    /** Event emitted when a schema id is resolved. */
    record SchemaResolvedEvent(String instanceName, int schemaId, boolean cacheHit) {}

    /** Event emitted when the decode loop ends. */
    record DecodeStoppedEvent(String instanceName, int recordCount, int trailingBytes, DecodeTermination termination) {}
}
