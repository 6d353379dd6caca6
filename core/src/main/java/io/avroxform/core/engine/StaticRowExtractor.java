package io.avroxform.core.engine;

import io.avroxform.core.error.TypeMismatchException;
import io.avroxform.core.model.Row;
import io.avroxform.core.model.Value;
import io.avroxform.core.model.Value.IntValue;
import io.avroxform.core.model.Value.ObjectValue;
import io.avroxform.core.model.Value.TextValue;
import java.util.List;
import java.util.Objects;

/**
 * Fixed four-column layout used when dynamic columns are not configured: {@code username} and
 * {@code tweet} as text, {@code timestamp} as a formatted date-time and the first byte of {@code
 * photo}.
 */
final class StaticRowExtractor implements RowExtractor {

    static final List<String> FIELDS = List.of("username", "tweet", "timestamp", "photo");

    private final FieldFormatter formatter;
    private final String instanceName;

    StaticRowExtractor(FieldFormatter formatter, String instanceName) {
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.instanceName = instanceName;
    }

    @Override
    public Row extract(Value record, int recordIndex) {
        if (!(record instanceof ObjectValue object)) {
            throw mismatch(recordIndex, "expected OBJECT record, got " + record.tag(), null);
        }
        String username = text(object, "username", recordIndex);
        String tweet = text(object, "tweet", recordIndex);

        Value timestamp = require(object, "timestamp", recordIndex);
        if (!(timestamp instanceof IntValue)) {
            throw mismatch(recordIndex, "field 'timestamp' expected INT, got " + timestamp.tag(), null);
        }
        String formattedTimestamp;
        try {
            formattedTimestamp = formatter.formatTimestamp(timestamp);
        } catch (TypeMismatchException e) {
            throw mismatch(recordIndex, "field 'timestamp': " + e.getMessage(), e);
        }

        String photo;
        try {
            photo = FieldFormatter.firstByte(require(object, "photo", recordIndex));
        } catch (TypeMismatchException e) {
            throw mismatch(recordIndex, "field 'photo': " + e.getMessage(), e);
        }
        return Row.of(username, tweet, formattedTimestamp, photo);
    }

    private String text(ObjectValue object, String field, int recordIndex) {
        Value value = require(object, field, recordIndex);
        if (!(value instanceof TextValue text)) {
            throw mismatch(recordIndex, "field '" + field + "' expected TEXT, got " + value.tag(), null);
        }
        return text.value();
    }

    private Value require(ObjectValue object, String field, int recordIndex) {
        Value value = object.get(field);
        if (value == null) {
            throw mismatch(recordIndex, "field '" + field + "' is missing", null);
        }
        return value;
    }

    private TypeMismatchException mismatch(int recordIndex, String detail, Throwable cause) {
        return new TypeMismatchException("record " + recordIndex + ": " + detail, cause, instanceName, recordIndex);
    }
}
