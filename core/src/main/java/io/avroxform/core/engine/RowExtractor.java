package io.avroxform.core.engine;

import io.avroxform.core.model.Row;
import io.avroxform.core.model.Value;

/**
 * Turns one decoded record into one output row. Implementations are immutable and shared across
 * concurrent invocations.
 */
interface RowExtractor {

    /**
     * Extracts the row for a record.
     *
     * @param record      the decoded record
     * @param recordIndex zero-based position of the record in its payload, for error reporting
     * @return the row, one cell per output column
     * @throws io.avroxform.core.error.TypeMismatchException if a value has the wrong tag
     * @throws io.avroxform.core.error.PathException         if a column path cannot be resolved
     */
    Row extract(Value record, int recordIndex);
}
