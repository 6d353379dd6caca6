package io.avroxform.core.spi;

/**
 * Pluggable binary record codec SPI. Implementations turn schema text into a {@link
 * CompiledSchema} that can decode records from the front of a byte buffer.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface RecordCodec {

    /**
     * Returns the codec identifier, e.g. {@code "avro"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles schema text into an immutable, thread-safe handle.
     *
     * @param schemaText the schema definition as obtained from a file or the registry
     * @return a compiled schema ready for decoding
     * @throws io.avroxform.core.error.SchemaCompileException if the schema text is invalid
     */
    CompiledSchema compile(String schemaText);
}
