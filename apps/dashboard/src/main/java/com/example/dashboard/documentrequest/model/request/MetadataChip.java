package com.example.dashboard.documentrequest.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetadataChip(
        @JsonProperty("keyId") Long keyId,
        @JsonProperty("value") String value
) {}
