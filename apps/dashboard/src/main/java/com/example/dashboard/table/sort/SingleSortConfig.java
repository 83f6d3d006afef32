package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.SortState;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.function.BiConsumer;

/**
 * Single-column sort.
 *
 * @param column           sorted column, empty or null when unsorted
 * @param direction        sorted direction, null when unsorted
 * @param onSort           receives every new {@code (column, direction)}, in both modes
 * @param initialDirection direction applied by the first click on a column
 * @param mode             {@link OperatingMode#CLIENT} by default
 */
@Builder(toBuilder = true)
public record SingleSortConfig(
        @Nullable String column,
        @Nullable SortDirection direction,
        @Nullable BiConsumer<String, SortDirection> onSort,
        SortDirection initialDirection,
        OperatingMode mode
) implements SortConfig {

    public static final SortDirection DEFAULT_INITIAL_DIRECTION = SortDirection.ASC;

    public SingleSortConfig {
        if (initialDirection == null) initialDirection = DEFAULT_INITIAL_DIRECTION;
        mode = OperatingMode.orDefault(mode);
    }

    @Override
    public SortType type() {
        return SortType.SINGLE;
    }

    public SortState state() {
        return new SortState(column, direction);
    }

    public SingleSortConfig withState(SortState state) {
        return toBuilder().column(state.column()).direction(state.direction()).build();
    }
}
