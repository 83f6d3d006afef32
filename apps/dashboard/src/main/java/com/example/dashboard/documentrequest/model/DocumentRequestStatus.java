package com.example.dashboard.documentrequest.model;

import org.springframework.lang.Nullable;

public enum DocumentRequestStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    STOPPED;

    @Nullable
    public static DocumentRequestStatus fromCode(@Nullable String code) {
        if (code == null) {
            return null;
        }
        for (DocumentRequestStatus status : values()) {
            if (status.name().equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return null;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }
}
