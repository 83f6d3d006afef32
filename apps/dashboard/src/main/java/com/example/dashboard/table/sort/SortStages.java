package com.example.dashboard.table.sort;

import com.example.dashboard.table.engine.TableStage;
import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.SortState;
import com.example.dashboard.table.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
public final class SortStages {

    private SortStages() {}

    public static <T> TableStage<T> forConfig(@Nullable SortConfig config, ValueComparator values) {
        if (config == null || config.mode() == OperatingMode.SERVER) {
            return TableStage.passThrough();
        }
        return switch (config.type()) {
            case SINGLE -> single((SingleSortConfig) config, values);
            case MULTI -> multi((MultiSortConfig) config, values);
        };
    }

    private static <T> TableStage<T> single(SingleSortConfig config, ValueComparator values) {
        SortState state = config.state();
        if (!state.isActive()) {
            return TableStage.passThrough();
        }
        return sorted(RowComparators.forState(state, values));
    }

    private static <T> TableStage<T> multi(MultiSortConfig config, ValueComparator values) {
        List<SortEntry> sorts = config.sorts();
        if (sorts == null) {
            log.warn("Multi-column sort enabled without a sort list, rows are passed through unsorted");
            return TableStage.passThrough();
        }
        if (sorts.isEmpty()) {
            return TableStage.passThrough();
        }
        return sorted(RowComparators.forEntries(sorts, values));
    }

    private static <T> TableStage<T> sorted(Comparator<T> comparator) {
        return rows -> {
            List<T> copy = new ArrayList<>(rows);
            copy.sort(comparator);
            return copy;
        };
    }
}
