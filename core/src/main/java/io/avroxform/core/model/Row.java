package io.avroxform.core.model;

import java.util.List;
import java.util.Objects;

/** One output line: ordered text cells, consumed immediately by the emitter. */
public record Row(List<String> cells) {

    public Row {
        Objects.requireNonNull(cells, "cells must not be null");
        cells = List.copyOf(cells);
    }

    public static Row of(String... cells) {
        return new Row(List.of(cells));
    }

    public int size() {
        return cells.size();
    }
}
