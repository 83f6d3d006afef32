package com.example.dashboard.query;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Query results keyed by query key. An entry is served while it is younger than the TTL;
 * expired entries are dropped when they are read.
 */
@Slf4j
public class InMemoryQueryCache<T> implements QueryCache<T> {

    private final ConcurrentHashMap<String, CacheEntry<T>> cache = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryQueryCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public InMemoryQueryCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        log.info("Initialized in-memory query cache with TTL: {}", ttl);
    }

    @Override
    public Mono<T> get(String key) {
        return Mono.fromSupplier(() -> live(key))
                .doOnNext(v -> log.debug("Cache hit for key: {}", key))
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Cache miss for key: {}", key);
                    return Mono.empty();
                }));
    }

    @Override
    public Mono<T> put(String key, T value) {
        return Mono.fromSupplier(() -> {
            cache.put(key, new CacheEntry<>(value, clock.instant().plus(ttl)));
            log.debug("Cached value for key: {}", key);
            return value;
        });
    }

    @Override
    public Mono<Void> invalidate(String key) {
        return Mono.fromRunnable(() -> {
            cache.remove(key);
            log.debug("Invalidated cache for key: {}", key);
        });
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(() -> {
            cache.clear();
            log.info("Cleared all cache entries");
        });
    }

    public int size() {
        return cache.size();
    }

    private T live(String key) {
        CacheEntry<T> entry = cache.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpiredAt(clock.instant())) {
            cache.remove(key, entry);
            return null;
        }
        return entry.value();
    }

    private record CacheEntry<T>(T value, Instant expiresAt) {
        boolean isExpiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
