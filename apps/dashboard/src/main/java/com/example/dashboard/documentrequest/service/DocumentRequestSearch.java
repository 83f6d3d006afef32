package com.example.dashboard.documentrequest.service;

import com.example.dashboard.common.util.RetryUtils;
import com.example.dashboard.config.properties.QueryProperties;
import com.example.dashboard.documentrequest.client.DocumentRequestSearchClient;
import com.example.dashboard.documentrequest.exception.DocumentRequestSearchException;
import com.example.dashboard.documentrequest.model.DocumentRequest;
import com.example.dashboard.documentrequest.model.DocumentRequestFilters;
import com.example.dashboard.documentrequest.model.request.DocumentRequestSearchRequest;
import com.example.dashboard.documentrequest.model.request.SortItem;
import com.example.dashboard.documentrequest.model.response.DocumentRequestSearchResponse;
import com.example.dashboard.table.model.SortDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Server-side search over document requests with 1-based paging.
 * <p>
 * The last search parameters are kept so that paging, page size changes and refreshes repeat
 * the same query. Each call takes a sequence number and only the newest call may update the
 * state; older responses are dropped. Failures end up in {@link SearchState#error()}, the
 * returned {@link Mono} never errors.
 */
@Slf4j
public class DocumentRequestSearch {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final List<SortItem> DEFAULT_SORTS = List.of(new SortItem("id", SortDirection.DESC));

    private final DocumentRequestSearchClient client;
    private final int retryCount;
    private final Duration retryDelay;
    private final Consumer<SearchState> listener;
    private final AtomicLong sequence = new AtomicLong();

    private volatile SearchState state = SearchState.INITIAL;
    private volatile SearchParams lastSearch;

    public DocumentRequestSearch(DocumentRequestSearchClient client,
                                 QueryProperties properties,
                                 @Nullable Consumer<SearchState> listener) {
        this.client = Objects.requireNonNull(client, "client");
        this.retryCount = properties.retryCount();
        this.retryDelay = properties.retryDelay();
        this.listener = listener;
    }

    @NonNull
    public Mono<SearchState> search(DocumentRequestFilters filters) {
        return search(filters, DEFAULT_PAGE, DEFAULT_PAGE_SIZE, DEFAULT_SORTS);
    }

    @NonNull
    public Mono<SearchState> search(DocumentRequestFilters filters, int page, int size, List<SortItem> sorts) {
        return Mono.defer(() -> {
            SearchParams params = new SearchParams(
                    filters != null ? filters : DocumentRequestFilters.empty(),
                    Math.max(DEFAULT_PAGE, page),
                    size > 0 ? size : DEFAULT_PAGE_SIZE,
                    sorts != null ? List.copyOf(sorts) : DEFAULT_SORTS);
            return execute(params);
        });
    }

    /**
     * Repeats the last search on another page. A request for the page that is already
     * loading or already shown is not sent again; use {@link #refresh()} to reload it.
     */
    @NonNull
    public Mono<SearchState> goToPage(int page) {
        return Mono.defer(() -> {
            SearchParams last = lastSearch;
            if (last == null) {
                return Mono.just(state);
            }
            if (last.page() == page && (state.loading() || state.page() == page)) {
                log.debug("Page {} is already loading or shown", page);
                return Mono.just(state);
            }
            return search(last.filters(), page, last.size(), last.sorts());
        });
    }

    /**
     * Repeats the last search with a new page size, starting again at page 1.
     */
    @NonNull
    public Mono<SearchState> changePageSize(int size) {
        return Mono.defer(() -> {
            SearchParams last = lastSearch;
            if (last == null) {
                return Mono.just(state);
            }
            return search(last.filters(), DEFAULT_PAGE, size, last.sorts());
        });
    }

    /**
     * Repeats the last search with different sorts, starting again at page 1.
     */
    @NonNull
    public Mono<SearchState> changeSorts(List<SortItem> sorts) {
        return Mono.defer(() -> {
            SearchParams last = lastSearch;
            if (last == null) {
                return Mono.just(state);
            }
            return search(last.filters(), DEFAULT_PAGE, last.size(), sorts);
        });
    }

    @NonNull
    public Mono<SearchState> refresh() {
        return Mono.defer(() -> {
            SearchParams last = lastSearch;
            if (last == null) {
                return Mono.just(state);
            }
            return search(last.filters(), last.page(), last.size(), last.sorts());
        });
    }

    /**
     * Forgets the last search and returns to the initial state. Responses still in flight
     * are dropped.
     */
    public void reset() {
        sequence.incrementAndGet();
        lastSearch = null;
        update(SearchState.INITIAL);
        log.info("Document request search reset");
    }

    @NonNull
    public SearchState getState() {
        return state;
    }

    @Nullable
    public DocumentRequestFilters getLastFilters() {
        SearchParams last = lastSearch;
        return last != null ? last.filters() : null;
    }

    private Mono<SearchState> execute(SearchParams params) {
        lastSearch = params;
        long ticket = sequence.incrementAndGet();
        update(state.startLoading());
        log.info("Searching document requests: page={}, size={}, sorts={}",
                params.page(), params.size(), params.sorts());

        DocumentRequestSearchRequest body = DocumentRequestSearchRequest.from(params.filters(), params.sorts());
        return client.search(body, params.page(), params.size())
                .retryWhen(Retry.fixedDelay(retryCount, retryDelay)
                        .filter(RetryUtils.retryablePredicate())
                        .doBeforeRetry(signal -> log.warn("Retrying document request search: attempt={}, error={}",
                                signal.totalRetries() + 2, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .switchIfEmpty(Mono.error(() -> new DocumentRequestSearchException(0, "Search returned no response")))
                .map(SearchState::from)
                .onErrorResume(error -> {
                    log.error("Document request search failed: {}", error.toString());
                    return Mono.just(state.failed(messageOf(error)));
                })
                .map(next -> settle(ticket, next));
    }

    private SearchState settle(long ticket, SearchState next) {
        if (ticket != sequence.get()) {
            log.debug("Discarding stale search response, ticket={}", ticket);
            return state;
        }
        update(next);
        if (next.error() == null) {
            log.info("Document request search returned {} of {} results (page {}/{})",
                    next.data().size(), next.totalElements(), next.page(), next.totalPages());
        }
        return next;
    }

    private void update(SearchState next) {
        state = next;
        if (listener != null) {
            listener.accept(next);
        }
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        if (error instanceof DocumentRequestSearchException ex && ex.getStatusCode() > 0) {
            return "Search failed: " + ex.getStatusCode();
        }
        return "An error occurred";
    }

    private record SearchParams(
            DocumentRequestFilters filters,
            int page,
            int size,
            List<SortItem> sorts
    ) {}

    /**
     * Search results and status.
     *
     * @param page 1-based page of {@code data}
     */
    public record SearchState(
            boolean loading,
            @Nullable String error,
            List<DocumentRequest> data,
            int page,
            int size,
            long totalElements,
            int totalPages,
            List<SortItem> sorts
    ) {
        public static final SearchState INITIAL = new SearchState(
                false, null, List.of(), DEFAULT_PAGE, DEFAULT_PAGE_SIZE, 0, 0, DEFAULT_SORTS);

        public SearchState {
            data = data == null ? List.of() : List.copyOf(data);
            sorts = sorts == null ? List.of() : List.copyOf(sorts);
        }

        static SearchState from(DocumentRequestSearchResponse response) {
            return new SearchState(false, null, response.content(), response.page(), response.size(),
                    response.totalElements(), response.totalPages(), response.sorts());
        }

        SearchState startLoading() {
            return new SearchState(true, null, data, page, size, totalElements, totalPages, sorts);
        }

        SearchState failed(String message) {
            return new SearchState(false, message, List.of(), page, size, totalElements, totalPages, sorts);
        }
    }
}
