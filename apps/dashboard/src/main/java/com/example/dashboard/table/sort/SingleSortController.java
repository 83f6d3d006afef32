package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.SortState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Owns one {@code (column, direction)} pair.
 * <p>
 * Repeated clicks on the same column cycle initial direction, opposite direction, unsorted.
 * Clicking another column starts over with the initial direction.
 */
@Slf4j
public class SingleSortController {

    private final SortDirection initialDirection;
    private final Consumer<SortState> listener;
    private SortState current;

    public SingleSortController() {
        this(SingleSortConfig.DEFAULT_INITIAL_DIRECTION, SortState.UNSORTED, state -> {});
    }

    public SingleSortController(SortDirection initialDirection,
                                @Nullable SortState initialState,
                                Consumer<SortState> listener) {
        this.initialDirection = Objects.requireNonNull(initialDirection, "initialDirection");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.current = initialState == null ? SortState.UNSORTED : initialState;
    }

    public SortState current() {
        return current;
    }

    public SortState toggle(String column) {
        SortState next;
        if (!current.isSortedBy(column)) {
            next = SortState.of(column, initialDirection);
        } else if (current.direction() == initialDirection) {
            next = SortState.of(column, initialDirection.opposite());
        } else {
            next = SortState.UNSORTED;
        }
        log.debug("Sort toggled on '{}': {} -> {}", column, current, next);
        current = next;
        listener.accept(next);
        return next;
    }

    public void reset() {
        current = SortState.UNSORTED;
        listener.accept(current);
    }

    @Nullable
    public SortDirection directionOf(String column) {
        return current.isSortedBy(column) ? current.direction() : null;
    }
}
