package com.example.dashboard.documentrequest.service;

import com.example.dashboard.config.properties.QueryProperties;
import com.example.dashboard.documentrequest.client.DocumentRequestSearchClient;
import com.example.dashboard.documentrequest.model.DocumentRequest;
import com.example.dashboard.documentrequest.model.DocumentRequestFilters;
import com.example.dashboard.documentrequest.model.DocumentRequestStatus;
import com.example.dashboard.documentrequest.service.DocumentRequestSearch.SearchState;
import com.example.dashboard.table.engine.EmptyStateConfig;
import com.example.dashboard.table.engine.ErrorState;
import com.example.dashboard.table.engine.LoadingState;
import com.example.dashboard.table.engine.PaginatedDataTable;
import com.example.dashboard.table.engine.RowActionsConfig;
import com.example.dashboard.table.engine.TableEngineFactory;
import com.example.dashboard.table.engine.TableView;
import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.RowKey;
import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.TableColumn;
import com.example.dashboard.table.pagination.PaginationConfig;
import com.example.dashboard.table.selection.SelectionConfig;
import com.example.dashboard.table.sort.MultiSortConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Document request list: a server-mode table whose sort and paging events run a new search
 * and whose rows, totals and status come from the search state.
 * <p>
 * Not thread-safe. Search results are applied on the thread that completes the search, so
 * callers must serialize access to {@link #view()}.
 */
@Slf4j
public class DocumentRequestTable {

    public static final String EMPTY_MESSAGE = "No document requests found.";
    public static final String EMPTY_DESCRIPTION = "Try adjusting your filters.";
    public static final String DETAILS_PATH = "/document-request/";

    private final List<TableColumn<DocumentRequest>> columns = DocumentRequestColumns.all();
    private final DocumentRequestSearch search;
    private final PaginatedDataTable<DocumentRequest> table;

    private MultiSortConfig sort;
    private PaginationConfig pagination;
    private List<Object> selectedIds = List.of();

    public DocumentRequestTable(TableEngineFactory factory,
                                DocumentRequestSearchClient client,
                                QueryProperties queryProperties) {
        this.sort = factory.multiSort()
                .sorts(SortItems.toSortEntries(DocumentRequestSearch.DEFAULT_SORTS, columns))
                .onSort(this::onSort)
                .mode(OperatingMode.SERVER)
                .build();
        this.pagination = factory.pagination()
                .pageSize(DocumentRequestSearch.DEFAULT_PAGE_SIZE)
                .onPageChange(this::onPageChange)
                .onPageSizeChange(this::onPageSizeChange)
                .mode(OperatingMode.SERVER)
                .build();
        this.table = factory.<DocumentRequest>table(List.of(), columns)
                .rowKey(RowKey.of(DocumentRequest::id))
                .sort(sort)
                .pagination(pagination)
                .selection(selectionConfig())
                .rowActions(RowActionsConfig.<DocumentRequest>builder()
                        .render(row -> DETAILS_PATH + row.id())
                        .width("80px")
                        .build())
                .emptyState(new EmptyStateConfig(EMPTY_MESSAGE, EMPTY_DESCRIPTION))
                .build();
        this.search = new DocumentRequestSearch(client, queryProperties, this::apply);
    }

    /**
     * Runs a new search from page 1 with the current sort.
     */
    public Mono<SearchState> applyFilters(DocumentRequestFilters filters) {
        List<SortEntry> sorts = sort.sorts() != null ? sort.sorts() : List.of();
        return search.search(filters, DocumentRequestSearch.DEFAULT_PAGE, pagination.pageSize(),
                SortItems.toSortItems(sorts));
    }

    public Mono<SearchState> refresh() {
        return search.refresh();
    }

    public void reset() {
        search.reset();
        selectedIds = List.of();
        table.setSelection(selectionConfig());
    }

    public TableView<DocumentRequest> view() {
        return table.view();
    }

    public PaginatedDataTable<DocumentRequest> table() {
        return table;
    }

    public SearchState searchState() {
        return search.getState();
    }

    public List<Object> getSelectedIds() {
        return selectedIds;
    }

    /**
     * Whether any loaded row is still queued or processing. Unknown status codes count as pending.
     */
    public boolean hasPendingRequests() {
        return search.getState().data().stream()
                .map(row -> row.documentStatus() == null ? null : row.documentStatus().refDataValue())
                .map(DocumentRequestStatus::fromCode)
                .anyMatch(status -> status == null || !status.isTerminal());
    }

    private void onSort(List<SortEntry> entries) {
        search.changeSorts(SortItems.toSortItems(entries)).subscribe();
    }

    private void onPageChange(int page) {
        search.goToPage(page).subscribe();
    }

    private void onPageSizeChange(int size) {
        search.changePageSize(size).subscribe();
    }

    private void onSelectionChange(List<Object> ids) {
        selectedIds = ids;
        log.debug("{} document requests selected", ids.size());
    }

    private SelectionConfig<DocumentRequest> selectionConfig() {
        return SelectionConfig.<DocumentRequest>builder()
                .selectedIds(selectedIds)
                .onSelectionChange(this::onSelectionChange)
                .getRowId(DocumentRequest::id)
                .bulkActionsEnabled(true)
                .build();
    }

    private void apply(SearchState state) {
        sort = sort.withSorts(SortItems.toSortEntries(state.sorts(), columns));
        pagination = pagination.toBuilder()
                .currentPage(state.page())
                .pageSize(state.size())
                .totalItems((int) Math.min(Integer.MAX_VALUE, state.totalElements()))
                .build();
        table.setSort(sort);
        table.setPagination(pagination);
        table.setLoading(LoadingState.of(state.loading()));
        table.setError(state.error() != null ? ErrorState.of(state.error(), () -> refresh().subscribe()) : null);
        table.setData(state.data());
    }
}
