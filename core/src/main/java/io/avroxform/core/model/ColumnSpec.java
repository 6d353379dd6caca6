package io.avroxform.core.model;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable list of output columns for dynamic extraction. Built once from the {@code
 * value_N}/{@code type_N} properties and shared by every invocation.
 */
public final class ColumnSpec implements Iterable<ColumnSpec.Column> {

    private static final ColumnSpec EMPTY = new ColumnSpec(List.of());

    /**
     * One output column.
     *
     * @param path path expression addressing the leaf inside a record, e.g. {@code photo/0}
     * @param type how the leaf is rendered
     */
    public record Column(String path, DeclaredType type) {
        public Column {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    private final List<Column> columns;

    private ColumnSpec(List<Column> columns) {
        this.columns = List.copyOf(columns);
    }

    public static ColumnSpec of(List<Column> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        return columns.isEmpty() ? EMPTY : new ColumnSpec(columns);
    }

    public static ColumnSpec of(Column... columns) {
        return of(List.of(columns));
    }

    /** Spec used in static mode, where the layout is fixed. */
    public static ColumnSpec empty() {
        return EMPTY;
    }

    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public Column get(int index) {
        return columns.get(index);
    }

    @Override
    public Iterator<Column> iterator() {
        return columns.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnSpec that)) return false;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnSpec" + columns;
    }
}
