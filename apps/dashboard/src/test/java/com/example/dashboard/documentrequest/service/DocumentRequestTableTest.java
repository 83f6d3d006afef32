package com.example.dashboard.documentrequest.service;

import com.example.dashboard.config.properties.QueryProperties;
import com.example.dashboard.config.properties.TableProperties;
import com.example.dashboard.documentrequest.client.DocumentRequestSearchClient;
import com.example.dashboard.documentrequest.exception.DocumentRequestSearchException;
import com.example.dashboard.documentrequest.model.DocumentRequest;
import com.example.dashboard.documentrequest.model.DocumentRequestFilters;
import com.example.dashboard.documentrequest.model.request.DocumentRequestSearchRequest;
import com.example.dashboard.documentrequest.model.request.SortItem;
import com.example.dashboard.documentrequest.model.response.DocumentRequestSearchResponse;
import com.example.dashboard.table.engine.ColumnHeader;
import com.example.dashboard.table.engine.RowActionsConfig;
import com.example.dashboard.table.engine.TableEngineFactory;
import com.example.dashboard.table.engine.TableStatus;
import com.example.dashboard.table.engine.TableView;
import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.TableColumn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.example.dashboard.util.DocumentRequestTestBuilder.aDocumentRequest;
import static com.example.dashboard.util.DocumentRequestTestBuilder.aResponse;
import static com.example.dashboard.util.DocumentRequestTestBuilder.documentRequests;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentRequestTable")
class DocumentRequestTableTest {

    private static final List<SortItem> BY_ID = List.of(new SortItem("id", SortDirection.DESC));

    @Mock
    private DocumentRequestSearchClient client;

    private DocumentRequestTable table;

    @BeforeEach
    void setUp() {
        TableEngineFactory factory = new TableEngineFactory(TableProperties.defaults());
        table = new DocumentRequestTable(factory, client, QueryProperties.defaults());
    }

    private static DocumentRequestSearchResponse firstPage() {
        return aResponse(documentRequests(1, 10), 1, 10, 25, BY_ID);
    }

    private void loadFirstPage() {
        when(client.search(any(), anyInt(), anyInt())).thenReturn(Mono.just(firstPage()));
        table.applyFilters(DocumentRequestFilters.empty()).block();
    }

    @Test
    @DisplayName("should show the empty state and the default sort before searching")
    void shouldShowEmptyStateBeforeSearching() {
        TableView<DocumentRequest> view = table.view();

        assertThat(view.status().kind()).isEqualTo(TableStatus.Kind.EMPTY);
        assertThat(view.status().message()).isEqualTo(DocumentRequestTable.EMPTY_MESSAGE);
        assertThat(view.headers().get(0).sortDirection()).isEqualTo(SortDirection.DESC);
        assertThat(view.headers().get(0).sortIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("should render the page returned by the search")
    void shouldRenderSearchResults() {
        loadFirstPage();

        TableView<DocumentRequest> view = table.view();
        List<TableColumn<DocumentRequest>> columns = view.columns();
        TableColumn<DocumentRequest> actions = columns.get(columns.size() - 1);

        assertThat(view.status().isReady()).isTrue();
        assertThat(view.rows()).hasSize(10);
        assertThat(view.pagination().info().totalItems()).isEqualTo(25);
        assertThat(view.pagination().info().totalPages()).isEqualTo(3);
        assertThat(view.pagination().info().summary()).isEqualTo("Showing 1 of 3 (10 of 25 results)");
        assertThat(actions.key()).isEqualTo(RowActionsConfig.COLUMN_KEY);
        assertThat(actions.display(view.rows().get(0))).isEqualTo("/document-request/1");
    }

    @Nested
    @DisplayName("user events")
    class UserEvents {

        @Test
        @DisplayName("should search with the added sort column")
        void shouldSearchWithAddedSort() {
            loadFirstPage();
            ArgumentCaptor<DocumentRequestSearchRequest> captor = ArgumentCaptor.forClass(DocumentRequestSearchRequest.class);

            table.table().onHeaderClick("documentStatus.refDataValue");

            verify(client, times(2)).search(captor.capture(), eq(1), eq(10));
            assertThat(captor.getAllValues().get(1).sorts()).containsExactly(
                    new SortItem("id", SortDirection.DESC),
                    new SortItem("documentStatus", SortDirection.DESC));
        }

        @Test
        @DisplayName("should search for the requested page")
        void shouldSearchRequestedPage() {
            loadFirstPage();

            table.table().onNextPage();

            verify(client).search(any(), eq(2), eq(10));
        }

        @Test
        @DisplayName("should search once when the page size changes")
        void shouldSearchOnceOnPageSizeChange() {
            loadFirstPage();

            table.table().onPageSizeChange(20);

            verify(client).search(any(), eq(1), eq(20));
            verify(client, times(2)).search(any(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("should keep selected ids")
        void shouldKeepSelectedIds() {
            loadFirstPage();
            DocumentRequest row = table.view().rows().get(2);

            table.table().onRowSelectionToggle(row);

            assertThat(table.getSelectedIds()).containsExactly(3L);
            assertThat(table.view().selection().showBulkActions()).isTrue();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should show the error and retry with a refresh")
        void shouldShowErrorAndRetry() {
            when(client.search(any(), anyInt(), anyInt()))
                    .thenReturn(Mono.error(new DocumentRequestSearchException(400, "Invalid date range")))
                    .thenReturn(Mono.just(firstPage()));

            table.applyFilters(DocumentRequestFilters.empty()).block();

            TableStatus status = table.view().status();
            assertThat(status.kind()).isEqualTo(TableStatus.Kind.ERROR);
            assertThat(status.message()).isEqualTo("Invalid date range");

            table.table().onRetry();

            assertThat(table.view().status().isReady()).isTrue();
            assertThat(table.view().rows()).hasSize(10);
        }
    }

    @Test
    @DisplayName("should report pending requests only while a loaded row is not finished")
    void shouldReportPendingRequests() {
        List<DocumentRequest> finished = List.of(
                aDocumentRequest().withId(1L).withStatus("COMPLETED").build(),
                aDocumentRequest().withId(2L).withStatus("failed").build());
        List<DocumentRequest> running = List.of(
                aDocumentRequest().withId(1L).withStatus("COMPLETED").build(),
                aDocumentRequest().withId(2L).withStatus("PROCESSING").build());
        when(client.search(any(), anyInt(), anyInt()))
                .thenReturn(Mono.just(aResponse(finished, 1, 10, 2, BY_ID)))
                .thenReturn(Mono.just(aResponse(running, 1, 10, 2, BY_ID)));

        assertThat(table.hasPendingRequests()).isFalse();
        table.applyFilters(DocumentRequestFilters.empty()).block();
        assertThat(table.hasPendingRequests()).isFalse();
        table.refresh().block();
        assertThat(table.hasPendingRequests()).isTrue();
    }

    @Test
    @DisplayName("should forget results and selection on reset")
    void shouldResetResultsAndSelection() {
        loadFirstPage();
        table.table().onRowSelectionToggle(table.view().rows().get(0));

        table.reset();

        assertThat(table.view().rows()).isEmpty();
        assertThat(table.getSelectedIds()).isEmpty();
        assertThat(table.searchState().loading()).isFalse();
        List<ColumnHeader> headers = table.view().headers();
        assertThat(headers.get(0).sortDirection()).isEqualTo(SortDirection.DESC);
    }
}
