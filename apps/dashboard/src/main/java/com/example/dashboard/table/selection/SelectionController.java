package com.example.dashboard.table.selection;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Row selection by key.
 * <p>
 * The select-all indicators only look at the ids passed to the last {@link #selectAll} or
 * {@link #toggleSelectAll} call, i.e. the visible page. Filtering, sorting or paging never
 * clears the selection; only {@link #deselectAll()} does. A {@code null} key is a valid key,
 * so rows without an id can still be selected.
 */
@Slf4j
public class SelectionController<K> {

    private final Set<K> selected = new LinkedHashSet<>();
    private List<K> visibleSnapshot = List.of();

    public SelectionController() {
    }

    public SelectionController(Collection<? extends K> initialSelected) {
        selected.addAll(initialSelected);
    }

    public boolean isSelected(K key) {
        return selected.contains(key);
    }

    public int selectedCount() {
        return selected.size();
    }

    /**
     * Selected keys in the order they were selected.
     */
    public List<K> selectedIds() {
        return copyOf(selected);
    }

    public void toggle(K key) {
        if (!selected.remove(key)) {
            selected.add(key);
        }
    }

    public void selectAll(Collection<? extends K> ids) {
        visibleSnapshot = copyOf(ids);
        selected.addAll(ids);
    }

    /**
     * Deselects {@code ids} when all of them are selected, otherwise selects all of them.
     */
    public void toggleSelectAll(Collection<? extends K> ids) {
        visibleSnapshot = copyOf(ids);
        if (selected.containsAll(ids)) {
            selected.removeAll(ids);
        } else {
            selected.addAll(ids);
        }
    }

    public void deselectAll() {
        log.debug("Clearing {} selected row(s)", selected.size());
        selected.clear();
    }

    /**
     * Replaces the selection with keys pushed by the caller.
     */
    public void replaceAll(Collection<? extends K> ids) {
        selected.clear();
        selected.addAll(ids);
    }

    public boolean isAllSelected() {
        return stateOf(visibleSnapshot) == SelectAllState.ALL;
    }

    public boolean isPartiallySelected() {
        return stateOf(visibleSnapshot) == SelectAllState.SOME;
    }

    public SelectAllState selectAllState() {
        return stateOf(visibleSnapshot);
    }

    /**
     * Tri-state of an arbitrary visible list. Does not touch the snapshot.
     */
    public SelectAllState stateOf(Collection<? extends K> ids) {
        if (ids.isEmpty()) {
            return SelectAllState.NONE;
        }
        long selectedOnPage = ids.stream().filter(selected::contains).count();
        if (selectedOnPage == 0) {
            return SelectAllState.NONE;
        }
        return selectedOnPage == ids.size() ? SelectAllState.ALL : SelectAllState.SOME;
    }

    static <E> List<E> copyOf(Collection<? extends E> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
