package com.example.dashboard.table.model;

import org.springframework.lang.Nullable;

/**
 * Single-column sort state. The unsorted state is {@code ("", null)}.
 */
public record SortState(
        String column,
        @Nullable SortDirection direction
) {
    public static final SortState UNSORTED = new SortState("", null);

    public SortState {
        if (column == null) column = "";
    }

    public static SortState of(String column, SortDirection direction) {
        return new SortState(column, direction);
    }

    public boolean isActive() {
        return !column.isEmpty() && direction != null;
    }

    public boolean isSortedBy(String candidate) {
        return isActive() && column.equals(candidate);
    }
}
