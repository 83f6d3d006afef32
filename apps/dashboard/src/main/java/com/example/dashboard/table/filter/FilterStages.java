package com.example.dashboard.table.filter;

import com.example.dashboard.common.util.StringSanitizer;
import com.example.dashboard.table.engine.TableStage;
import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.TableColumn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;

@Slf4j
public final class FilterStages {

    private FilterStages() {}

    public static <T> TableStage<T> forConfig(@Nullable FilterConfig config, List<TableColumn<T>> columns) {
        if (config == null) {
            return TableStage.passThrough();
        }
        if (config.value() == null) {
            log.warn("Filter enabled without a value, rows are passed through unfiltered");
            return TableStage.passThrough();
        }
        if (config.mode() == OperatingMode.SERVER) {
            return TableStage.passThrough();
        }
        String query = config.value();
        List<TableColumn<T>> searchable = List.copyOf(columns);
        return rows -> {
            List<T> filtered = TextFilter.apply(rows, query, searchable);
            if (filtered != rows) {
                log.debug("Filter '{}' kept {} of {} rows", StringSanitizer.forLog(query), filtered.size(), rows.size());
            }
            return filtered;
        };
    }
}
