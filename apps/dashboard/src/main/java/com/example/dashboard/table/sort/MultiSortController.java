package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.SortEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Ordered, priority-tagged list of sort entries with a bounded depth.
 * <p>
 * Priorities are always {@code 0..k-1} in list order after every mutation. Adding a column
 * beyond {@code maxSorts} evicts the primary (priority 0) entry. Removing the last column
 * restores the default sort.
 */
@Slf4j
public class MultiSortController {

    private final int maxSorts;
    private final SortDirection initialDirection;
    private final List<SortEntry> defaultSorts;
    private final Consumer<List<SortEntry>> listener;
    private List<SortEntry> entries;

    public MultiSortController() {
        this(MultiSortConfig.DEFAULT_MAX_SORTS, MultiSortConfig.DEFAULT_INITIAL_DIRECTION,
                MultiSortConfig.DEFAULT_SORTS, MultiSortConfig.DEFAULT_SORTS, sorts -> {});
    }

    public MultiSortController(int maxSorts,
                               SortDirection initialDirection,
                               List<SortEntry> defaultSorts,
                               @Nullable List<SortEntry> initialSorts,
                               Consumer<List<SortEntry>> listener) {
        if (maxSorts < 1) {
            throw new IllegalArgumentException("maxSorts must be at least 1: " + maxSorts);
        }
        this.maxSorts = maxSorts;
        this.initialDirection = Objects.requireNonNull(initialDirection, "initialDirection");
        this.defaultSorts = renumber(byPriority(Objects.requireNonNull(defaultSorts, "defaultSorts")));
        this.listener = Objects.requireNonNull(listener, "listener");
        this.entries = initialSorts == null ? this.defaultSorts : renumber(byPriority(initialSorts));
    }

    public static MultiSortController forConfig(MultiSortConfig config) {
        Consumer<List<SortEntry>> listener = config.onSort() != null ? config.onSort() : sorts -> {};
        return new MultiSortController(config.maxSorts(), config.initialDirection(),
                config.defaultSorts(), config.sorts(), listener);
    }

    public List<SortEntry> sorts() {
        return entries;
    }

    public int getMaxSorts() {
        return maxSorts;
    }

    /**
     * Adds the column with the initial direction, flips it, or removes it once flipped.
     */
    public List<SortEntry> toggle(String column) {
        int index = indexOf(column);
        List<SortEntry> next = new ArrayList<>(entries);

        if (index < 0) {
            next.add(SortEntry.of(column, initialDirection, next.size()));
            if (next.size() > maxSorts) {
                SortEntry evicted = next.stream()
                        .filter(e -> e.priority() == 0)
                        .findFirst()
                        .orElse(next.get(0));
                next.remove(evicted);
                log.debug("Sort depth {} exceeded, evicted '{}'", maxSorts, evicted.column());
            }
            return commit(renumber(next));
        }

        SortEntry existing = next.get(index);
        if (existing.direction() == initialDirection) {
            next.set(index, existing.withDirection(initialDirection.opposite()));
            return commit(List.copyOf(next));
        }

        next.remove(index);
        return commit(next.isEmpty() ? defaultSorts : renumber(next));
    }

    /**
     * Sets a column to a direction. A new column at capacity replaces the lowest-priority entry.
     */
    public List<SortEntry> setSort(String column, SortDirection direction) {
        Objects.requireNonNull(direction, "direction");
        int index = indexOf(column);
        List<SortEntry> next = new ArrayList<>(entries);
        if (index >= 0) {
            next.set(index, next.get(index).withDirection(direction));
        } else if (next.size() >= maxSorts) {
            int last = next.size() - 1;
            next.set(last, SortEntry.of(column, direction, last));
        } else {
            next.add(SortEntry.of(column, direction, next.size()));
        }
        return commit(renumber(next));
    }

    public List<SortEntry> removeSort(String column) {
        List<SortEntry> next = new ArrayList<>(entries);
        next.removeIf(e -> e.column().equals(column));
        return commit(next.isEmpty() ? defaultSorts : renumber(next));
    }

    public List<SortEntry> clearSorts() {
        return commit(defaultSorts);
    }

    public List<SortEntry> resetToDefault() {
        return clearSorts();
    }

    @Nullable
    public SortDirection directionOf(String column) {
        int index = indexOf(column);
        return index < 0 ? null : entries.get(index).direction();
    }

    /**
     * 1-based position of the column in the sort, or -1 when it is not sorted.
     */
    public int sortIndexOf(String column) {
        int index = indexOf(column);
        return index < 0 ? -1 : index + 1;
    }

    public Optional<SortEntry> primary() {
        return entries.stream().filter(e -> e.priority() == 0).findFirst();
    }

    private int indexOf(String column) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).column().equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private List<SortEntry> commit(List<SortEntry> next) {
        entries = next;
        listener.accept(next);
        return next;
    }

    static List<SortEntry> byPriority(List<SortEntry> sorts) {
        List<SortEntry> ordered = new ArrayList<>(sorts);
        ordered.sort(Comparator.comparingInt(SortEntry::priority));
        return ordered;
    }

    static List<SortEntry> renumber(List<SortEntry> sorts) {
        List<SortEntry> renumbered = new ArrayList<>(sorts.size());
        for (int i = 0; i < sorts.size(); i++) {
            renumbered.add(sorts.get(i).withPriority(i));
        }
        return List.copyOf(renumbered);
    }
}
