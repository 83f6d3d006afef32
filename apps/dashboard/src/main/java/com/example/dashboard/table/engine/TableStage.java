package com.example.dashboard.table.engine;

import java.util.List;

/**
 * One step of the filter, sort, paginate pipeline.
 * <p>
 * Every feature resolves to either a local computation or {@link #passThrough()} depending
 * on its operating mode, so the pipeline itself never branches on mode.
 */
@FunctionalInterface
public interface TableStage<T> {

    List<T> apply(List<T> rows);

    static <T> TableStage<T> passThrough() {
        return rows -> rows;
    }
}
