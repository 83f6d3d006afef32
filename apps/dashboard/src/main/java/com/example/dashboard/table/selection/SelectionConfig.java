package com.example.dashboard.table.selection;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Opt-in row selection. Selection has no operating mode: the caller owns the selected ids
 * and the table reports every change through {@code onSelectionChange}.
 *
 * @param selectedIds        currently selected row ids, which may include {@code null}
 * @param onSelectionChange  receives the full selection after each change
 * @param getRowId           row id extractor, the table row key when null
 * @param bulkActionsEnabled whether bulk actions show while rows are selected
 */
@Builder(toBuilder = true)
public record SelectionConfig<T>(
        List<Object> selectedIds,
        @Nullable Consumer<List<Object>> onSelectionChange,
        @Nullable Function<T, Object> getRowId,
        boolean bulkActionsEnabled
) {
    public SelectionConfig {
        selectedIds = selectedIds == null ? List.of() : SelectionController.copyOf(selectedIds);
    }

    public static <T> SelectionConfig<T> of(List<Object> selectedIds, Consumer<List<Object>> onSelectionChange) {
        return new SelectionConfig<>(selectedIds, Objects.requireNonNull(onSelectionChange), null, false);
    }
}
