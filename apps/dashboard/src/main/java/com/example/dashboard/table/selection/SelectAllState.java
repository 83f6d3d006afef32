package com.example.dashboard.table.selection;

/**
 * Header checkbox state relative to the visible rows.
 */
public enum SelectAllState {
    NONE,
    SOME,
    ALL;

    public boolean isAllSelected() {
        return this == ALL;
    }

    public boolean isPartiallySelected() {
        return this == SOME;
    }
}
