package com.example.dashboard.table.engine;

import com.example.dashboard.table.model.SortDirection;
import org.springframework.lang.Nullable;

/**
 * Header cell of a display column.
 *
 * @param sortDirection direction of this column in the current sort, null when unsorted
 * @param sortIndex     1-based multi-sort position, -1 when unsorted or single sort
 */
public record ColumnHeader(
        String key,
        String header,
        boolean sortable,
        @Nullable String width,
        @Nullable SortDirection sortDirection,
        int sortIndex
) {
    @Nullable
    public String ariaSort() {
        return sortDirection == null ? null : sortDirection.ariaSort();
    }
}
