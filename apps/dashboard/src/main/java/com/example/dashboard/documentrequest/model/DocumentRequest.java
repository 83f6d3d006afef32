package com.example.dashboard.documentrequest.model;

import org.springframework.lang.Nullable;

/**
 * Document request row as returned by the search API.
 */
public record DocumentRequest(
        Long id,
        ReferenceDataRef sourceSystem,
        ReferenceDataRef documentType,
        ReferenceDataRef documentName,
        ReferenceDataRef documentStatus,
        String createdDat,
        @Nullable String lastUpdateDat,
        @Nullable String createUidHeader,
        @Nullable String createUidToken
) {}
