package com.example.dashboard.table.engine;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * What the table body shows instead of, or along with, its rows.
 */
public record TableStatus(
        Kind kind,
        @Nullable String message,
        @Nullable String description
) {
    public enum Kind {
        READY,
        LOADING,
        EMPTY,
        ERROR
    }

    public TableStatus {
        Objects.requireNonNull(kind, "kind");
    }

    public static TableStatus ready() {
        return new TableStatus(Kind.READY, null, null);
    }

    public boolean isReady() {
        return kind == Kind.READY;
    }
}
