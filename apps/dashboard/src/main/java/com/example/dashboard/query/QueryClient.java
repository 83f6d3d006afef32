package com.example.dashboard.query;

import com.example.dashboard.config.properties.QueryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Hands out {@link ApiQuery} builders preset with the configured retry policy and a cache
 * shared by every query.
 */
@Component
public class QueryClient {

    private final QueryProperties properties;
    private final QueryCache<Object> cache;

    @Autowired
    public QueryClient(QueryProperties properties) {
        this(properties, new InMemoryQueryCache<>(properties.cacheTtl()));
    }

    public QueryClient(QueryProperties properties, QueryCache<Object> cache) {
        this.properties = properties;
        this.cache = cache;
    }

    public <T> ApiQuery.ApiQueryBuilder<T> query(@Nullable String queryKey, Supplier<Mono<T>> queryFn) {
        return ApiQuery.<T>builder()
                .queryKey(queryKey)
                .queryFn(queryFn)
                .cache(cache)
                .retryCount(properties.retryCount())
                .retryDelay(properties.retryDelay());
    }

    public Mono<Void> invalidate(String queryKey) {
        return cache.invalidate(queryKey);
    }

    public Mono<Void> clear() {
        return cache.clear();
    }
}
