package io.avroxform.core.engine;

import io.avroxform.core.model.Row;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Accumulates rows as comma-delimited lines, one line per row, each terminated by {@code \n}.
 *
 * <p>
 * A cell is quoted only when it contains a comma, a double quote, {@code \r} or {@code \n};
 * quotes inside a quoted cell are doubled.
 *
 * <p>
 * Not thread-safe: one emitter belongs to one invocation.
 */
public final class CsvEmitter {

    public static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final StringBuilder line = new StringBuilder();
    private int rowCount;

    /** Appends one row to the output buffer. */
    public void emit(Row row) {
        line.setLength(0);
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) {
                line.append(DELIMITER);
            }
            appendCell(row.cells().get(i));
        }
        line.append('\n');
        byte[] bytes = line.toString().getBytes(StandardCharsets.UTF_8);
        buffer.write(bytes, 0, bytes.length);
        rowCount++;
    }

    public int rowCount() {
        return rowCount;
    }

    /** Returns a copy of everything emitted so far. */
    public byte[] toByteArray() {
        return buffer.toByteArray();
    }

    private void appendCell(String cell) {
        if (!needsQuotes(cell)) {
            line.append(cell);
            return;
        }
        line.append(QUOTE);
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (c == QUOTE) {
                line.append(QUOTE);
            }
            line.append(c);
        }
        line.append(QUOTE);
    }

    static boolean needsQuotes(String cell) {
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (c == DELIMITER || c == QUOTE || c == '\r' || c == '\n') {
                return true;
            }
        }
        return false;
    }
}
