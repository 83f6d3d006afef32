package com.example.dashboard.query;

import org.springframework.lang.Nullable;

/**
 * Snapshot of a query. {@code loading} is set for a first fetch, {@code fetching} for a
 * refetch that keeps showing the previous data.
 */
public record QueryState<T>(
        @Nullable T data,
        boolean loading,
        boolean fetching,
        @Nullable QueryError error
) {
    public static <T> QueryState<T> idle() {
        return new QueryState<>(null, false, false, null);
    }

    public static <T> QueryState<T> success(@Nullable T data) {
        return new QueryState<>(data, false, false, null);
    }

    public static <T> QueryState<T> failure(@Nullable T previousData, QueryError error) {
        return new QueryState<>(previousData, false, false, error);
    }

    public QueryState<T> startLoading() {
        return new QueryState<>(data, true, false, null);
    }

    public QueryState<T> startFetching() {
        return new QueryState<>(data, false, true, null);
    }

    public boolean hasError() {
        return error != null;
    }
}
