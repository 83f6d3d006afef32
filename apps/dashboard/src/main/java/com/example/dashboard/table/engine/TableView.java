package com.example.dashboard.table.engine;

import com.example.dashboard.table.filter.FilterConfig;
import com.example.dashboard.table.model.TableColumn;
import com.example.dashboard.table.pagination.PageItem;
import com.example.dashboard.table.pagination.PaginationInfo;
import com.example.dashboard.table.selection.SelectAllState;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Render-ready snapshot of a {@link PaginatedDataTable}.
 *
 * @param rows       rows of the current page, after filter and sort
 * @param columns    display columns, including the row actions column
 * @param headers    header cells in column order
 * @param filter     filter input state, null when filtering is off
 * @param pagination pagination bar state, null when pagination is off
 * @param selection  selection state, null when selection is off
 * @param status     loading, error or empty indicator
 */
public record TableView<T>(
        List<T> rows,
        List<TableColumn<T>> columns,
        List<ColumnHeader> headers,
        @Nullable FilterView filter,
        @Nullable PaginationView pagination,
        @Nullable SelectionView selection,
        TableStatus status
) {
    public record FilterView(
            String value,
            String placeholder,
            int debounceMs,
            boolean loading,
            boolean disabled
    ) {
        static FilterView of(FilterConfig config) {
            return new FilterView(
                    config.value() == null ? "" : config.value(),
                    config.placeholder(),
                    config.debounceMs(),
                    config.loading(),
                    config.disabled());
        }
    }

    /**
     * @param visible false when there is nothing to page through
     */
    public record PaginationView(
            PaginationInfo info,
            List<PageItem> pageItems,
            List<Integer> pageSizeOptions,
            boolean showPageSizeSelector,
            boolean showInfo,
            boolean visible
    ) {}

    /**
     * @param visibleKeys      keys of the rows on this page
     * @param state            header checkbox state for this page
     * @param selectedCount    selected rows across all pages
     * @param showBulkActions  whether bulk actions should render
     */
    public record SelectionView(
            List<Object> visibleKeys,
            List<Object> selectedKeys,
            SelectAllState state,
            int selectedCount,
            boolean showBulkActions
    ) {
        public boolean isSelected(Object key) {
            return selectedKeys.contains(key);
        }
    }
}
