package com.example.dashboard.table.model;

import java.util.Objects;

/**
 * One key of a multi-column sort. Priority 0 is the primary key.
 */
public record SortEntry(
        String column,
        SortDirection direction,
        int priority
) {
    public SortEntry {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(direction, "direction");
        if (priority < 0) {
            throw new IllegalArgumentException("Sort priority must be 0 or greater: " + priority);
        }
    }

    public static SortEntry of(String column, SortDirection direction, int priority) {
        return new SortEntry(column, direction, priority);
    }

    public SortEntry withPriority(int newPriority) {
        return new SortEntry(column, direction, newPriority);
    }

    public SortEntry withDirection(SortDirection newDirection) {
        return new SortEntry(column, newDirection, priority);
    }
}
