package com.example.dashboard.table.pagination;

import com.example.dashboard.table.engine.TableStage;
import com.example.dashboard.table.model.OperatingMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

@Slf4j
public final class PaginationStages {

    private PaginationStages() {}

    public static <T> TableStage<T> forConfig(@Nullable PaginationConfig config) {
        if (config == null || config.mode() == OperatingMode.SERVER) {
            return TableStage.passThrough();
        }
        if (!isCoherent(config)) {
            log.warn("Pagination enabled with page size {}, rows are passed through unpaged", config.pageSize());
            return TableStage.passThrough();
        }
        int size = config.pageSize();
        int requested = config.currentPage();
        return rows -> PageSlicer.slice(rows, PageSlicer.clampPage(requested, PageSlicer.totalPages(rows.size(), size)), size);
    }

    public static boolean isCoherent(PaginationConfig config) {
        return config.pageSize() > 0;
    }
}
