package com.example.dashboard.documentrequest.model.response;

import com.example.dashboard.documentrequest.model.DocumentRequest;
import com.example.dashboard.documentrequest.model.request.SortItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One page of search results. {@code page} is 1-based.
 */
public record DocumentRequestSearchResponse(
        @JsonProperty("content") List<DocumentRequest> content,
        @JsonProperty("page") int page,
        @JsonProperty("size") int size,
        @JsonProperty("totalElements") long totalElements,
        @JsonProperty("totalPages") int totalPages,
        @JsonProperty("first") boolean first,
        @JsonProperty("last") boolean last,
        @JsonProperty("sorts") List<SortItem> sorts,
        @JsonProperty("links") @Nullable PaginationLinks links
) {
    public DocumentRequestSearchResponse {
        content = content == null ? List.of() : List.copyOf(content);
        sorts = sorts == null ? List.of() : List.copyOf(sorts);
    }
}
