package com.example.dashboard.documentrequest.model;

/**
 * Reference data value embedded in a document request.
 */
public record ReferenceDataRef(
        Long id,
        String refDataValue,
        String description
) {}
