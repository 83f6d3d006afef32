package com.example.dashboard.table.engine;

import org.springframework.lang.Nullable;

/**
 * Fetch failure reported by the caller, with an optional retry action.
 */
public record ErrorState(
        boolean error,
        String message,
        @Nullable Runnable onRetry
) {
    public ErrorState {
        if (message == null) message = "";
    }

    public static ErrorState of(String message, @Nullable Runnable onRetry) {
        return new ErrorState(true, message, onRetry);
    }
}
