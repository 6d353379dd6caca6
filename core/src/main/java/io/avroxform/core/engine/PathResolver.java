package io.avroxform.core.engine;

import io.avroxform.core.error.PathException;
import io.avroxform.core.model.Value;
import io.avroxform.core.model.Value.ArrayValue;
import io.avroxform.core.model.Value.ObjectValue;
import java.util.Objects;

/**
 * Resolves slash-delimited path expressions against a decoded {@link Value}.
 *
 * <p>
 * Each segment is either a non-negative integer literal, which indexes into an {@link
 * ArrayValue}, or any other text, which looks up a field of an {@link ObjectValue}. {@code
 * "2/name"} selects element 2 of the root array, then its {@code name} field. Resolution descends
 * one segment at a time; every unexpected tag, missing key or out-of-range index is a {@link
 * PathException}.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class PathResolver {

    /** Segment separator. */
    public static final char SEPARATOR = '/';

    private PathResolver() {}

    /**
     * Resolves {@code path} against {@code root}.
     *
     * @param root the decoded record (or any sub-value)
     * @param path the path expression
     * @return the addressed value
     * @throws PathException if any segment cannot be applied
     */
    public static Value resolve(Value root, String path) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        return descend(root, path, path);
    }

    private static Value descend(Value current, String remaining, String fullPath) {
        int separator = remaining.indexOf(SEPARATOR);
        if (separator < 0) {
            return step(current, remaining, fullPath);
        }
        Value next = step(current, remaining.substring(0, separator), fullPath);
        return descend(next, remaining.substring(separator + 1), fullPath);
    }

    private static Value step(Value current, String segment, String fullPath) {
        if (isIndex(segment)) {
            if (!(current instanceof ArrayValue array)) {
                throw new PathException(
                        "path '" + fullPath + "': index '" + segment + "' applied to " + current.tag() + ", expected ARRAY",
                        null,
                        null);
            }
            int index = parseIndex(segment);
            if (index < 0 || index >= array.size()) {
                throw new PathException(
                        "path '" + fullPath + "': index " + segment + " out of range for array of size " + array.size(),
                        null,
                        null);
            }
            return array.elements().get(index);
        }
        if (!(current instanceof ObjectValue object)) {
            throw new PathException(
                    "path '" + fullPath + "': key '" + segment + "' applied to " + current.tag() + ", expected OBJECT",
                    null,
                    null);
        }
        Value field = object.get(segment);
        if (field == null) {
            throw new PathException("path '" + fullPath + "': key '" + segment + "' not found", null, null);
        }
        return field;
    }

    /** True for a non-empty run of ASCII digits. */
    static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /** Parses a digit run; values beyond {@code int} range map to -1 (always out of range). */
    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
