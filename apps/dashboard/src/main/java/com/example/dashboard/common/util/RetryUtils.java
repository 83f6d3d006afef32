package com.example.dashboard.common.util;

import com.example.dashboard.exception.ApiException;
import org.springframework.lang.NonNull;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Retry conditions shared by every data fetch.
 */
public final class RetryUtils {

    private RetryUtils() {}

    /**
     * Transient failures are server-side errors (5xx) and timeouts. Client errors are final.
     *
     * @param throwable the exception to check
     * @return true if the call may succeed when repeated
     */
    public static boolean isRetryable(@NonNull Throwable throwable) {
        if (throwable instanceof ApiException ex) {
            return ex.isServerError();
        }
        return throwable instanceof TimeoutException;
    }

    @NonNull
    public static Predicate<Throwable> retryablePredicate() {
        return RetryUtils::isRetryable;
    }
}
