package com.example.dashboard.documentrequest.model.request;

import com.example.dashboard.table.model.SortDirection;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One sort criterion of the search API, in priority order within its list.
 */
public record SortItem(
        @JsonProperty("property") String property,
        @JsonProperty("direction") SortDirection direction
) {
    public SortItem {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(direction, "direction");
    }
}
