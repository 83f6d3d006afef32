package com.example.dashboard.documentrequest.exception;

import com.example.dashboard.exception.ApiException;

public class DocumentRequestSearchException extends ApiException {

    public static final String SERVICE_NAME = "document-request-search";

    public DocumentRequestSearchException(int statusCode, String message) {
        super(SERVICE_NAME, statusCode, message);
    }

    public DocumentRequestSearchException(int statusCode, String message, String responseBody) {
        super(SERVICE_NAME, statusCode, message, responseBody);
    }

    public DocumentRequestSearchException(String message, Throwable cause) {
        super(SERVICE_NAME, message, cause);
    }
}
