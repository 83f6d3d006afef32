package com.example.dashboard.documentrequest.model.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

public record PaginationLinks(
        @JsonProperty("self") String self,
        @JsonProperty("first") String first,
        @JsonProperty("previous") @Nullable String previous,
        @JsonProperty("next") @Nullable String next,
        @JsonProperty("last") String last
) {}
