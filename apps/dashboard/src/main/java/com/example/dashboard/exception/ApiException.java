package com.example.dashboard.exception;

import org.springframework.lang.Nullable;

/**
 * Failed call to a backend API. A status code of 0 means no response was received.
 */
public class ApiException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;
    private final String responseBody;

    public ApiException(String serviceName, int statusCode, String message) {
        this(serviceName, statusCode, message, null);
    }

    public ApiException(String serviceName, int statusCode, String message, @Nullable String responseBody) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public ApiException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.statusCode = 0;
        this.responseBody = null;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Nullable
    public String getResponseBody() {
        return responseBody;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "serviceName='" + serviceName + '\'' +
                ", statusCode=" + statusCode +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
