package com.example.dashboard.table.engine;

import lombok.Builder;

import java.util.Objects;
import java.util.function.Function;

/**
 * Per-row action cell, rendered as an extra trailing column.
 */
@Builder
public record RowActionsConfig<T>(
        Function<T, Object> render,
        String width,
        String header
) {
    public static final String COLUMN_KEY = "__actions";
    public static final String DEFAULT_HEADER = "Actions";
    public static final String DEFAULT_WIDTH = "120px";

    public RowActionsConfig {
        Objects.requireNonNull(render, "render");
        if (width == null || width.isBlank()) width = DEFAULT_WIDTH;
        if (header == null || header.isBlank()) header = DEFAULT_HEADER;
    }
}
