package com.example.dashboard.table.engine;

import com.example.dashboard.table.filter.FilterConfig;
import com.example.dashboard.table.filter.FilterStages;
import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.RowKey;
import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.SortState;
import com.example.dashboard.table.model.TableColumn;
import com.example.dashboard.table.pagination.PageSlicer;
import com.example.dashboard.table.pagination.PageWindow;
import com.example.dashboard.table.pagination.PaginationConfig;
import com.example.dashboard.table.pagination.PaginationInfo;
import com.example.dashboard.table.pagination.PaginationStages;
import com.example.dashboard.table.pagination.PaginationState;
import com.example.dashboard.table.selection.SelectionConfig;
import com.example.dashboard.table.selection.SelectionController;
import com.example.dashboard.table.sort.MultiSortConfig;
import com.example.dashboard.table.sort.MultiSortController;
import com.example.dashboard.table.sort.SingleSortConfig;
import com.example.dashboard.table.sort.SingleSortController;
import com.example.dashboard.table.sort.SortConfig;
import com.example.dashboard.table.sort.SortStages;
import com.example.dashboard.table.value.ValueComparator;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic table with opt-in filter, sort, pagination, selection and row actions.
 * <p>
 * Rows always flow through filter, then sort, then paginate. Each of those features runs
 * locally in {@link OperatingMode#CLIENT} mode and is skipped in {@link OperatingMode#SERVER}
 * mode, where the caller hands over rows it already processed. User events always reach the
 * caller's handlers; in client mode the table also applies them to its own state.
 * <p>
 * {@link #view()} is computed lazily and cached until an input changes. Instances are meant
 * to be driven by one event loop and are not thread-safe.
 */
@Slf4j
public class PaginatedDataTable<T> {

    private static final String DEFAULT_LOADING_MESSAGE = "Loading...";

    private final List<TableColumn<T>> columns;
    private final RowKey<T> rowKey;
    private final ValueComparator valueComparator;
    private final SelectionController<Object> selectionController = new SelectionController<>();

    private List<T> data;
    @Nullable private FilterConfig filter;
    @Nullable private SortConfig sort;
    @Nullable private PaginationConfig pagination;
    @Nullable private SelectionConfig<T> selection;
    @Nullable private RowActionsConfig<T> rowActions;
    private LoadingState loading;
    @Nullable private ErrorState error;
    private EmptyStateConfig emptyState;

    private TableStage<T> filterStage = TableStage.passThrough();
    private TableStage<T> sortStage = TableStage.passThrough();
    private TableStage<T> paginationStage = TableStage.passThrough();
    @Nullable private TableView<T> cachedView;

    @Builder
    private PaginatedDataTable(List<T> data,
                               List<TableColumn<T>> columns,
                               @Nullable RowKey<T> rowKey,
                               @Nullable FilterConfig filter,
                               @Nullable SortConfig sort,
                               @Nullable PaginationConfig pagination,
                               @Nullable SelectionConfig<T> selection,
                               @Nullable RowActionsConfig<T> rowActions,
                               @Nullable LoadingState loading,
                               @Nullable ErrorState error,
                               @Nullable EmptyStateConfig emptyState,
                               @Nullable ValueComparator valueComparator) {
        this.data = List.copyOf(Objects.requireNonNull(data, "data"));
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        this.rowKey = rowKey != null ? rowKey : RowKey.byId();
        this.filter = filter;
        this.sort = sort;
        this.pagination = pagination;
        this.selection = selection;
        this.rowActions = rowActions;
        this.loading = loading != null ? loading : LoadingState.IDLE;
        this.error = error;
        this.emptyState = emptyState != null ? emptyState : EmptyStateConfig.DEFAULT;
        this.valueComparator = valueComparator != null ? valueComparator : ValueComparator.defaultComparator();
        if (selection != null) {
            selectionController.replaceAll(selection.selectedIds());
        }
        restage();
    }

    // ========================================================================
    // View
    // ========================================================================

    @NonNull
    public TableView<T> view() {
        if (cachedView == null) {
            cachedView = computeView();
        }
        return cachedView;
    }

    private TableView<T> computeView() {
        List<T> filtered = filterStage.apply(data);
        List<T> sorted = sortStage.apply(filtered);
        List<T> rows = paginationStage.apply(sorted);
        log.debug("Table recomputed: {} rows, {} after filter, {} displayed", data.size(), filtered.size(), rows.size());

        List<TableColumn<T>> displayColumns = displayColumns();
        return new TableView<>(
                rows,
                displayColumns,
                headers(displayColumns),
                filter != null ? TableView.FilterView.of(filter) : null,
                paginationView(sorted.size()),
                selectionView(rows),
                status(rows));
    }

    private List<TableColumn<T>> displayColumns() {
        if (rowActions == null) {
            return columns;
        }
        RowActionsConfig<T> actions = rowActions;
        List<TableColumn<T>> withActions = new ArrayList<>(columns);
        withActions.add(new TableColumn<>(
                RowActionsConfig.COLUMN_KEY,
                actions.header(),
                false,
                actions.width(),
                (value, row) -> actions.render().apply(row)));
        return List.copyOf(withActions);
    }

    private List<ColumnHeader> headers(List<TableColumn<T>> displayColumns) {
        List<ColumnHeader> headers = new ArrayList<>(displayColumns.size());
        for (TableColumn<T> column : displayColumns) {
            SortDirection direction = null;
            int sortIndex = -1;
            if (sort != null) {
                switch (sort.type()) {
                    case SINGLE -> {
                        SortState state = ((SingleSortConfig) sort).state();
                        direction = state.isSortedBy(column.key()) ? state.direction() : null;
                    }
                    case MULTI -> {
                        List<SortEntry> sorts = ((MultiSortConfig) sort).sorts();
                        if (sorts != null) {
                            for (SortEntry entry : sorts) {
                                if (entry.column().equals(column.key())) {
                                    direction = entry.direction();
                                    sortIndex = entry.priority() + 1;
                                }
                            }
                        }
                    }
                }
            }
            headers.add(new ColumnHeader(column.key(), column.header(), column.sortable(),
                    column.width(), direction, sortIndex));
        }
        return List.copyOf(headers);
    }

    @Nullable
    private TableView.PaginationView paginationView(int locallyAvailable) {
        PaginationState state = paginationState(locallyAvailable);
        if (state == null) {
            return null;
        }
        PaginationConfig config = Objects.requireNonNull(pagination);
        return new TableView.PaginationView(
                PaginationInfo.of(state),
                PageWindow.compute(state.currentPage(), state.totalPages(), config.maxPageButtons()),
                config.pageSizeOptions(),
                config.pageSizeSelectorVisible(),
                config.showInfo(),
                state.totalItems() > 0);
    }

    @Nullable
    private PaginationState paginationState(int locallyAvailable) {
        if (pagination == null || !PaginationStages.isCoherent(pagination)) {
            return null;
        }
        int totalItems = pagination.mode() == OperatingMode.CLIENT ? locallyAvailable : pagination.totalItems();
        return new PaginationState(pagination.currentPage(), pagination.pageSize(), totalItems).clamped();
    }

    @Nullable
    private TableView.SelectionView selectionView(List<T> rows) {
        if (selection == null) {
            return null;
        }
        List<Object> visibleKeys = rows.stream().map(this::selectionKey).toList();
        int selectedCount = selectionController.selectedCount();
        return new TableView.SelectionView(
                visibleKeys,
                selectionController.selectedIds(),
                selectionController.stateOf(visibleKeys),
                selectedCount,
                selection.bulkActionsEnabled() && selectedCount > 0);
    }

    private TableStatus status(List<T> rows) {
        if (error != null && error.error()) {
            return new TableStatus(TableStatus.Kind.ERROR, error.message(), null);
        }
        if (loading.loading()) {
            String message = loading.message() != null ? loading.message() : DEFAULT_LOADING_MESSAGE;
            return new TableStatus(TableStatus.Kind.LOADING, message, null);
        }
        if (rows.isEmpty()) {
            return new TableStatus(TableStatus.Kind.EMPTY, emptyState.message(), emptyState.description());
        }
        return TableStatus.ready();
    }

    // ========================================================================
    // User events
    // ========================================================================

    public void onFilterChange(String value) {
        if (filter == null) {
            log.debug("Filter change ignored, filtering is not enabled");
            return;
        }
        FilterConfig current = filter;
        if (current.onChange() != null) {
            current.onChange().accept(value);
        }
        if (current.mode() == OperatingMode.CLIENT) {
            filter = current.withValue(value);
            restage();
        }
    }

    public void onSearch() {
        if (filter != null && filter.onSearch() != null) {
            filter.onSearch().run();
        }
    }

    public void onHeaderClick(String columnKey) {
        Optional<TableColumn<T>> column = columns.stream()
                .filter(c -> c.key().equals(columnKey))
                .findFirst();
        if (sort == null || column.isEmpty() || !column.get().sortable()) {
            log.debug("Header click on '{}' ignored, column is not sortable", columnKey);
            return;
        }
        switch (sort.type()) {
            case SINGLE -> toggleSingleSort((SingleSortConfig) sort, columnKey);
            case MULTI -> toggleMultiSort((MultiSortConfig) sort, columnKey);
        }
    }

    private void toggleSingleSort(SingleSortConfig config, String columnKey) {
        if (config.onSort() == null && config.mode() == OperatingMode.SERVER) {
            log.warn("Server-side sort has no onSort handler, click on '{}' ignored", columnKey);
            return;
        }
        SingleSortController controller = new SingleSortController(
                config.initialDirection(),
                config.state(),
                state -> {
                    if (config.onSort() != null) {
                        config.onSort().accept(state.column(), state.direction());
                    }
                });
        SortState next = controller.toggle(columnKey);
        if (config.mode() == OperatingMode.CLIENT) {
            sort = config.withState(next);
            restage();
        }
    }

    private void toggleMultiSort(MultiSortConfig config, String columnKey) {
        if (config.sorts() == null) {
            log.warn("Multi-column sort has no sort list, click on '{}' ignored", columnKey);
            return;
        }
        if (config.onSort() == null && config.mode() == OperatingMode.SERVER) {
            log.warn("Server-side sort has no onSort handler, click on '{}' ignored", columnKey);
            return;
        }
        List<SortEntry> next = MultiSortController.forConfig(config).toggle(columnKey);
        if (config.mode() == OperatingMode.CLIENT) {
            sort = config.withSorts(next);
            restage();
        }
    }

    /**
     * Requests a page. The page is clamped to the available range; asking for the page
     * already shown does nothing.
     */
    public void onPageChange(int page) {
        PaginationState state = currentPaginationState();
        if (state == null) {
            log.debug("Page change ignored, pagination is not enabled");
            return;
        }
        PaginationConfig config = Objects.requireNonNull(pagination);
        int target = PageSlicer.clampPage(page, state.totalPages());
        if (target == state.currentPage()) {
            return;
        }
        if (config.onPageChange() != null) {
            config.onPageChange().accept(target);
        } else if (config.mode() == OperatingMode.SERVER) {
            log.warn("Server-side pagination has no onPageChange handler, page {} ignored", target);
            return;
        }
        if (config.mode() == OperatingMode.CLIENT) {
            pagination = config.withCurrentPage(target);
            restage();
        }
    }

    public void onNextPage() {
        PaginationState state = currentPaginationState();
        if (state != null && !state.isLastPage()) {
            onPageChange(state.currentPage() + 1);
        }
    }

    public void onPreviousPage() {
        PaginationState state = currentPaginationState();
        if (state != null && !state.isFirstPage()) {
            onPageChange(state.currentPage() - 1);
        }
    }

    /**
     * Changes the page size and goes back to the first page.
     */
    public void onPageSizeChange(int size) {
        if (pagination == null) {
            log.debug("Page size change ignored, pagination is not enabled");
            return;
        }
        if (size <= 0) {
            log.warn("Ignoring page size {}", size);
            return;
        }
        PaginationConfig config = pagination;
        if (config.onPageSizeChange() != null) {
            config.onPageSizeChange().accept(size);
        }
        if (config.onPageChange() != null) {
            config.onPageChange().accept(1);
        }
        if (config.mode() == OperatingMode.CLIENT) {
            pagination = config.withPageSize(size);
            restage();
        }
    }

    public void onRowSelectionToggle(T row) {
        if (selection == null) {
            log.debug("Row selection ignored, selection is not enabled");
            return;
        }
        selectionController.toggle(selectionKey(row));
        selectionChanged();
    }

    /**
     * Header checkbox: selects the visible page, or deselects it when it is fully selected.
     */
    public void onToggleSelectAll() {
        if (selection == null) {
            return;
        }
        selectionController.toggleSelectAll(visibleKeys());
        selectionChanged();
    }

    public void onSelectAll() {
        if (selection == null) {
            return;
        }
        selectionController.selectAll(visibleKeys());
        selectionChanged();
    }

    public void onDeselectAll() {
        if (selection == null) {
            return;
        }
        selectionController.deselectAll();
        selectionChanged();
    }

    public void onRetry() {
        if (error != null && error.onRetry() != null) {
            error.onRetry().run();
        }
    }

    private void selectionChanged() {
        SelectionConfig<T> config = Objects.requireNonNull(selection);
        List<Object> selected = selectionController.selectedIds();
        selection = config.toBuilder().selectedIds(selected).build();
        if (config.onSelectionChange() != null) {
            config.onSelectionChange().accept(selected);
        }
        invalidate();
    }

    private List<Object> visibleKeys() {
        TableView.SelectionView view = view().selection();
        return view != null ? view.visibleKeys() : List.of();
    }

    private Object selectionKey(T row) {
        if (selection != null && selection.getRowId() != null) {
            return selection.getRowId().apply(row);
        }
        return rowKey.keyOf(row);
    }

    @Nullable
    private PaginationState currentPaginationState() {
        TableView.PaginationView view = view().pagination();
        if (view == null) {
            return null;
        }
        PaginationInfo info = view.info();
        return new PaginationState(info.currentPage(), info.pageSize(), info.totalItems());
    }

    // ========================================================================
    // Caller updates
    // ========================================================================

    public void setData(List<T> newData) {
        data = List.copyOf(Objects.requireNonNull(newData, "data"));
        invalidate();
    }

    public void setFilter(@Nullable FilterConfig newFilter) {
        filter = newFilter;
        restage();
    }

    public void setSort(@Nullable SortConfig newSort) {
        sort = newSort;
        restage();
    }

    public void setPagination(@Nullable PaginationConfig newPagination) {
        pagination = newPagination;
        restage();
    }

    public void setSelection(@Nullable SelectionConfig<T> newSelection) {
        selection = newSelection;
        if (newSelection != null) {
            selectionController.replaceAll(newSelection.selectedIds());
        }
        invalidate();
    }

    public void setRowActions(@Nullable RowActionsConfig<T> newRowActions) {
        rowActions = newRowActions;
        invalidate();
    }

    public void setLoading(boolean isLoading) {
        setLoading(LoadingState.of(isLoading));
    }

    public void setLoading(LoadingState newLoading) {
        loading = newLoading != null ? newLoading : LoadingState.IDLE;
        invalidate();
    }

    public void setError(@Nullable ErrorState newError) {
        error = newError;
        invalidate();
    }

    @Nullable
    public FilterConfig getFilter() {
        return filter;
    }

    @Nullable
    public SortConfig getSort() {
        return sort;
    }

    @Nullable
    public PaginationConfig getPagination() {
        return pagination;
    }

    public List<Object> getSelectedIds() {
        return selectionController.selectedIds();
    }

    private void restage() {
        filterStage = FilterStages.forConfig(filter, columns);
        sortStage = SortStages.forConfig(sort, valueComparator);
        paginationStage = PaginationStages.forConfig(pagination);
        invalidate();
    }

    private void invalidate() {
        cachedView = null;
    }
}
