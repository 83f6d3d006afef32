package com.example.dashboard.table.model;

/**
 * Where a table feature is computed.
 * <ul>
 *   <li>{@link #CLIENT}: the engine filters, sorts or slices the rows it was given</li>
 *   <li>{@link #SERVER}: the caller already did, the engine only renders and emits change events</li>
 * </ul>
 */
public enum OperatingMode {
    CLIENT,
    SERVER;

    public static OperatingMode orDefault(OperatingMode mode) {
        return mode == null ? CLIENT : mode;
    }
}
