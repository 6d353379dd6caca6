package io.avroxform.core.model;

import io.avroxform.core.error.TransformEvalException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Outcome of one invocation. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS} — the payload was transformed; {@code output} holds the delimited
 * rows and {@code rowCount} how many there are (possibly zero).</li>
 * <li>{@link Type#ERROR} — the invocation failed; {@code error} holds the cause and no output
 * is produced.</li>
 * </ul>
 */
public final class TransformResult {

    /** The type of transform outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private static final byte[] NO_OUTPUT = new byte[0];

    private final Type type;
    private final byte[] output;
    private final int rowCount;
    private final TransformEvalException error;

    private TransformResult(Type type, byte[] output, int rowCount, TransformEvalException error) {
        this.type = type;
        this.output = output;
        this.rowCount = rowCount;
        this.error = error;
    }

    /** Creates a SUCCESS result with the emitted rows. */
    public static TransformResult success(byte[] output, int rowCount) {
        Objects.requireNonNull(output, "output must not be null for SUCCESS");
        return new TransformResult(Type.SUCCESS, output, rowCount, null);
    }

    /** Creates an ERROR result; the output is always empty. */
    public static TransformResult error(TransformEvalException error) {
        Objects.requireNonNull(error, "error must not be null for ERROR");
        return new TransformResult(Type.ERROR, NO_OUTPUT, 0, error);
    }

    public Type type() {
        return type;
    }

    /** Returns the emitted bytes. Empty when {@code type() == ERROR}. */
    public byte[] output() {
        return output;
    }

    /** Returns the output decoded as UTF-8. */
    public String outputAsString() {
        return new String(output, StandardCharsets.UTF_8);
    }

    public int rowCount() {
        return rowCount;
    }

    /** Returns the failure cause. Only valid when {@code type() == ERROR}. */
    public TransformEvalException error() {
        return error;
    }

    /** Returns the error URN, or {@code null} for SUCCESS. */
    public String errorCode() {
        return error != null ? error.urn() : null;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "TransformResult[SUCCESS, rows=" + rowCount + "]";
            case ERROR -> "TransformResult[ERROR, code=" + error.urn() + "]";
        };
    }
}
