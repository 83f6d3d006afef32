package com.example.dashboard.query;

import com.example.dashboard.exception.ApiException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Failure of a data fetch as the view shows it.
 *
 * @param timestamp when the failure was recorded
 * @param status    HTTP status, 0 when no response was received
 * @param error     stable error category
 * @param message   human-readable message for display
 * @param service   backend service that failed, when known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryError(
        Instant timestamp,
        int status,
        String error,
        String message,
        @Nullable String service
) {
    public static final String DEFAULT_MESSAGE = "An error occurred";

    public static QueryError of(int status, String error, String message) {
        return new QueryError(Instant.now(), status, error, message, null);
    }

    public static QueryError from(Throwable throwable) {
        if (throwable instanceof ApiException ex) {
            return new QueryError(Instant.now(), ex.getStatusCode(), categoryOf(ex.getStatusCode()),
                    messageOf(ex), ex.getServiceName());
        }
        if (throwable instanceof TimeoutException) {
            return of(504, Categories.TIMEOUT, "The request timed out");
        }
        return of(500, Categories.INTERNAL_ERROR, messageOf(throwable));
    }

    public boolean isServerError() {
        return status >= 500 && status < 600;
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? DEFAULT_MESSAGE : message;
    }

    private static String categoryOf(int status) {
        if (status == 0) {
            return Categories.NETWORK_ERROR;
        }
        if (status == 404) {
            return Categories.NOT_FOUND;
        }
        if (status == 401 || status == 403) {
            return Categories.ACCESS_DENIED;
        }
        if (status >= 400 && status < 500) {
            return Categories.VALIDATION_ERROR;
        }
        return Categories.INTERNAL_ERROR;
    }

    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String NOT_FOUND = "not_found";
        public static final String TIMEOUT = "timeout";
        public static final String NETWORK_ERROR = "network_error";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }
}
