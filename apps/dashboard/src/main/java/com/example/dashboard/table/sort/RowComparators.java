package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.SortState;
import com.example.dashboard.table.value.NestedValueExtractor;
import com.example.dashboard.table.value.ValueComparator;

import java.util.Comparator;
import java.util.List;

/**
 * Row orderings built from sort state. Ties fall through to the next priority and
 * finally leave rows in their incoming order.
 */
public final class RowComparators {

    private RowComparators() {}

    public static <T> Comparator<T> forState(SortState state, ValueComparator values) {
        if (!state.isActive()) {
            return (a, b) -> 0;
        }
        String column = state.column();
        return (a, b) -> values.compare(
                NestedValueExtractor.extract(a, column),
                NestedValueExtractor.extract(b, column),
                state.direction());
    }

    public static <T> Comparator<T> forEntries(List<SortEntry> entries, ValueComparator values) {
        List<SortEntry> ordered = MultiSortController.byPriority(entries);
        return (a, b) -> {
            for (SortEntry entry : ordered) {
                int result = values.compare(
                        NestedValueExtractor.extract(a, entry.column()),
                        NestedValueExtractor.extract(b, entry.column()),
                        entry.direction());
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        };
    }
}
