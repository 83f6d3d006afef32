package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.SortEntry;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.function.Consumer;

/**
 * Multi-column sort.
 *
 * @param sorts            current entries, ordered by priority
 * @param onSort           receives every new entry list, in both modes
 * @param maxSorts         maximum number of sorted columns
 * @param initialDirection direction applied when a column joins the sort
 * @param defaultSorts     entries restored when the last column is removed
 * @param mode             {@link OperatingMode#CLIENT} by default
 */
@Builder(toBuilder = true)
public record MultiSortConfig(
        @Nullable List<SortEntry> sorts,
        @Nullable Consumer<List<SortEntry>> onSort,
        int maxSorts,
        SortDirection initialDirection,
        List<SortEntry> defaultSorts,
        OperatingMode mode
) implements SortConfig {

    public static final int DEFAULT_MAX_SORTS = 3;
    public static final SortDirection DEFAULT_INITIAL_DIRECTION = SortDirection.DESC;
    public static final List<SortEntry> DEFAULT_SORTS = List.of(SortEntry.of("id", SortDirection.DESC, 0));

    public MultiSortConfig {
        if (sorts != null) sorts = List.copyOf(sorts);
        if (maxSorts <= 0) maxSorts = DEFAULT_MAX_SORTS;
        if (initialDirection == null) initialDirection = DEFAULT_INITIAL_DIRECTION;
        defaultSorts = defaultSorts == null ? DEFAULT_SORTS : List.copyOf(defaultSorts);
        mode = OperatingMode.orDefault(mode);
    }

    @Override
    public SortType type() {
        return SortType.MULTI;
    }

    public MultiSortConfig withSorts(List<SortEntry> newSorts) {
        return toBuilder().sorts(newSorts).build();
    }
}
