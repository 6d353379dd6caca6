package io.avroxform.core.engine;

import io.avroxform.core.error.PathException;
import io.avroxform.core.error.TypeMismatchException;
import io.avroxform.core.model.ColumnSpec;
import io.avroxform.core.model.Row;
import io.avroxform.core.model.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One cell per configured column: resolve the column path, then format the leaf. */
final class DynamicRowExtractor implements RowExtractor {

    private final ColumnSpec columns;
    private final FieldFormatter formatter;
    private final String instanceName;

    DynamicRowExtractor(ColumnSpec columns, FieldFormatter formatter, String instanceName) {
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.instanceName = instanceName;
    }

    @Override
    public Row extract(Value record, int recordIndex) {
        List<String> cells = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            ColumnSpec.Column column = columns.get(i);
            String where = "record " + recordIndex + ", column " + (i + 1) + ": ";
            try {
                Value leaf = PathResolver.resolve(record, column.path());
                cells.add(formatter.format(leaf, column.type()));
            } catch (PathException e) {
                throw new PathException(where + e.getMessage(), e, instanceName, recordIndex);
            } catch (TypeMismatchException e) {
                throw new TypeMismatchException(
                        where + "path '" + column.path() + "': " + e.getMessage(), e, instanceName, recordIndex);
            }
        }
        return new Row(cells);
    }
}
