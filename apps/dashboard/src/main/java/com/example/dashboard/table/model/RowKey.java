package com.example.dashboard.table.model;

import com.example.dashboard.table.value.NestedValueExtractor;

import java.util.Objects;
import java.util.function.Function;

/**
 * Maps a row to the identifier used for selection and row identity.
 */
@FunctionalInterface
public interface RowKey<T> {

    String DEFAULT_COLUMN = "id";

    Object keyOf(T row);

    static <T> RowKey<T> column(String column) {
        Objects.requireNonNull(column, "column");
        return row -> NestedValueExtractor.extract(row, column);
    }

    static <T> RowKey<T> of(Function<? super T, ?> extractor) {
        Objects.requireNonNull(extractor, "extractor");
        return extractor::apply;
    }

    static <T> RowKey<T> byId() {
        return column(DEFAULT_COLUMN);
    }
}
