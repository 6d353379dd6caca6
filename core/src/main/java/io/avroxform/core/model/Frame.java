package io.avroxform.core.model;

import java.util.Objects;

/**
 * A payload split into its optional schema id and the record stream that follows the header.
 *
 * @param schemaId the id carried in the frame header, or {@code null} when the payload is
 *                 unframed (embedded schema)
 * @param records  the payload bytes holding back-to-back encoded records
 * @param offset   index of the first record byte in {@code records}
 */
public record Frame(Integer schemaId, byte[] records, int offset) {

    public Frame {
        Objects.requireNonNull(records, "records must not be null");
        if (offset < 0 || offset > records.length) {
            throw new IllegalArgumentException("offset out of range: " + offset);
        }
    }

    public boolean hasSchemaId() {
        return schemaId != null;
    }

    /** Number of record-stream bytes after the header. */
    public int length() {
        return records.length - offset;
    }

    @Override
    public String toString() {
        return "Frame[schemaId=" + schemaId + ", " + length() + " bytes]";
    }
}
