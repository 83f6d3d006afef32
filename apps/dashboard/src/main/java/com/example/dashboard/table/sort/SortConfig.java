package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.OperatingMode;

/**
 * Opt-in sorting, either one column at a time or several columns by priority.
 * Consumers switch on {@link #type()} rather than testing the concrete class.
 */
public sealed interface SortConfig permits SingleSortConfig, MultiSortConfig {

    SortType type();

    OperatingMode mode();
}
