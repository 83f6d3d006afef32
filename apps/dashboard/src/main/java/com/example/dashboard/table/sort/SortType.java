package com.example.dashboard.table.sort;

/**
 * Discriminator of {@link SortConfig}.
 */
public enum SortType {
    SINGLE,
    MULTI
}
