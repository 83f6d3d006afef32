package com.example.dashboard.table.engine;

import org.springframework.lang.Nullable;

public record LoadingState(boolean loading, @Nullable String message) {

    public static final LoadingState IDLE = new LoadingState(false, null);

    public static LoadingState of(boolean loading) {
        return loading ? new LoadingState(true, null) : IDLE;
    }
}
