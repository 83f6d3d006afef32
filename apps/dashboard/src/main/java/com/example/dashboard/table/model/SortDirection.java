package com.example.dashboard.table.model;

/**
 * Direction of a sorted column. An unsorted column is represented by {@code null}.
 */
public enum SortDirection {
    ASC,
    DESC;

    public SortDirection opposite() {
        return this == ASC ? DESC : ASC;
    }

    /**
     * Value for the {@code aria-sort} attribute of a sorted header cell.
     */
    public String ariaSort() {
        return this == ASC ? "ascending" : "descending";
    }
}
