package com.example.dashboard.query;

import com.example.dashboard.common.util.RetryUtils;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fetches data for a view and tracks it as a {@link QueryState}.
 * <p>
 * A fetch serves a cached value for {@code queryKey} while it is fresh, otherwise it calls
 * {@code queryFn}, retrying server errors and timeouts. Every fetch takes a sequence number;
 * a response that settles after a newer fetch was started is discarded. Failures never reach
 * the subscriber as error signals, they are reported through {@link QueryState#error()}.
 */
@Slf4j
public class ApiQuery<T> {

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    private final String queryKey;
    private final Supplier<Mono<T>> queryFn;
    private final QueryCache<Object> cache;
    private final int retryCount;
    private final Duration retryDelay;
    private final Consumer<T> onSuccess;
    private final Consumer<QueryError> onError;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<QueryState<T>> state = new AtomicReference<>(QueryState.idle());
    private final Sinks.Many<QueryState<T>> states = Sinks.many().replay().latest();

    @Builder
    private ApiQuery(@Nullable String queryKey,
                     Supplier<Mono<T>> queryFn,
                     @Nullable QueryCache<Object> cache,
                     int retryCount,
                     @Nullable Duration retryDelay,
                     @Nullable Consumer<T> onSuccess,
                     @Nullable Consumer<QueryError> onError) {
        this.queryKey = queryKey;
        this.queryFn = Objects.requireNonNull(queryFn, "queryFn");
        this.cache = cache;
        this.retryCount = Math.max(0, retryCount);
        this.retryDelay = retryDelay != null ? retryDelay : DEFAULT_RETRY_DELAY;
        this.onSuccess = onSuccess;
        this.onError = onError;
        states.tryEmitNext(QueryState.idle());
    }

    /**
     * Fetches, serving the cached value when it is still fresh.
     */
    @NonNull
    public Mono<QueryState<T>> fetch() {
        return execute(false);
    }

    /**
     * Fetches from the source, bypassing the cache.
     */
    @NonNull
    public Mono<QueryState<T>> refetch() {
        return execute(true);
    }

    /**
     * Refetches on a fixed interval until the subscription is cancelled.
     */
    @NonNull
    public Flux<QueryState<T>> refetchEvery(Duration interval) {
        return Flux.interval(interval).concatMap(tick -> refetch());
    }

    @NonNull
    public QueryState<T> state() {
        return state.get();
    }

    /**
     * Current state followed by every later change.
     */
    @NonNull
    public Flux<QueryState<T>> states() {
        return states.asFlux();
    }

    @NonNull
    public Mono<Void> invalidate() {
        if (queryKey == null || cache == null) {
            return Mono.empty();
        }
        return cache.invalidate(queryKey);
    }

    private Mono<QueryState<T>> execute(boolean refetch) {
        return Mono.defer(() -> {
            long ticket = sequence.incrementAndGet();
            return cached(refetch)
                    .map(data -> {
                        log.debug("Query served from cache: key={}", queryKey);
                        return QueryState.<T>success(data);
                    })
                    .switchIfEmpty(Mono.defer(() -> {
                        QueryState<T> current = state.get();
                        publish(refetch ? current.startFetching() : current.startLoading());
                        return load();
                    }))
                    .map(next -> settle(ticket, next));
        });
    }

    @SuppressWarnings("unchecked")
    private Mono<T> cached(boolean refetch) {
        if (refetch || queryKey == null || cache == null) {
            return Mono.empty();
        }
        return cache.get(queryKey).map(value -> (T) value);
    }

    private Mono<QueryState<T>> load() {
        return Mono.defer(queryFn)
                .retryWhen(Retry.fixedDelay(retryCount, retryDelay)
                        .filter(RetryUtils.retryablePredicate())
                        .doBeforeRetry(signal -> log.info("Retrying query: key={}, attempt={}, maxAttempts={}, delay={}",
                                queryKey, signal.totalRetries() + 2, retryCount + 1, retryDelay))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .flatMap(this::store)
                .map(data -> {
                    log.info("Query successful: key={}, fromCache=false", queryKey);
                    return QueryState.<T>success(data);
                })
                .defaultIfEmpty(QueryState.<T>success(null))
                .onErrorResume(error -> {
                    QueryError queryError = QueryError.from(error);
                    log.error("Query failed: key={}, status={}, error={}, message={}",
                            queryKey, queryError.status(), queryError.error(), queryError.message());
                    return Mono.just(QueryState.failure(state.get().data(), queryError));
                });
    }

    private Mono<T> store(T data) {
        if (queryKey == null || cache == null) {
            return Mono.just(data);
        }
        return cache.put(queryKey, data).thenReturn(data);
    }

    private QueryState<T> settle(long ticket, QueryState<T> next) {
        if (ticket != sequence.get()) {
            log.debug("Discarding stale response: key={}, ticket={}", queryKey, ticket);
            return state.get();
        }
        publish(next);
        if (next.error() != null) {
            if (onError != null) {
                onError.accept(next.error());
            }
        } else if (onSuccess != null && next.data() != null) {
            onSuccess.accept(next.data());
        }
        return next;
    }

    private void publish(QueryState<T> next) {
        state.set(next);
        states.emitNext(next, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
    }
}
