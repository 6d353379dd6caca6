package io.avroxform.core.spi;

/**
 * Fetches schema text by numeric id from a schema registry.
 *
 * <p>Implementations MUST be thread-safe; the engine calls them from concurrent invocations on
 * cache misses and never retries a failed call.
 */
public interface SchemaRegistryClient {

    /**
     * Fetches the schema registered under {@code schemaId}.
     *
     * @param schemaId the id taken from a frame header
     * @return the schema text, never null
     * @throws io.avroxform.core.error.RegistryException on a non-200 answer or transport failure
     */
    String fetchSchema(int schemaId);
}
