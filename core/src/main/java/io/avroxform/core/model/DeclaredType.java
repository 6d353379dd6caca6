package io.avroxform.core.model;

import java.util.Locale;

/**
 * Output interpretation of a column.
 *
 * <ul>
 * <li>{@link #PLAIN} — the leaf value is rendered with its generic text form.</li>
 * <li>{@link #TIMESTAMP} — the leaf value is whole seconds since the Unix epoch, rendered as
 * {@code yyyy-MM-dd HH:mm:ss}.</li>
 * </ul>
 */
public enum DeclaredType {
    PLAIN,
    TIMESTAMP;

    /**
     * Maps a configured {@code type_N} value. Only {@code timestamp} (any case) is special; every
     * other type name ({@code string}, {@code int}, ...) renders as plain text.
     */
    public static DeclaredType fromConfig(String value) {
        if (value != null && "timestamp".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return TIMESTAMP;
        }
        return PLAIN;
    }
}
