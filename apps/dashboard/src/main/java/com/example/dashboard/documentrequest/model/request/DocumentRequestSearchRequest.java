package com.example.dashboard.documentrequest.model.request;

import com.example.dashboard.documentrequest.model.DocumentRequestFilters;
import com.example.dashboard.documentrequest.model.MetadataChipSelection;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Search API body. Empty filters are left out of the JSON; {@code sorts} is always sent.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DocumentRequestSearchRequest(
        @JsonProperty("requestIds") @Nullable List<Long> requestIds,
        @JsonProperty("batchIds") @Nullable List<Long> batchIds,
        @JsonProperty("sourceSystems") @Nullable List<Long> sourceSystems,
        @JsonProperty("documentTypes") @Nullable List<Long> documentTypes,
        @JsonProperty("documentNames") @Nullable List<Long> documentNames,
        @JsonProperty("documentStatuses") @Nullable List<Long> documentStatuses,
        @JsonProperty("fromDate") @Nullable String fromDate,
        @JsonProperty("toDate") @Nullable String toDate,
        @JsonProperty("metadataChips") @Nullable List<MetadataChip> metadataChips,
        @JsonProperty("sorts") @JsonInclude(JsonInclude.Include.ALWAYS) List<SortItem> sorts
) {
    public DocumentRequestSearchRequest {
        sorts = sorts == null ? List.of() : List.copyOf(sorts);
    }

    public static DocumentRequestSearchRequest from(DocumentRequestFilters filters, List<SortItem> sorts) {
        return new DocumentRequestSearchRequest(
                nonEmpty(filters.requestIds()),
                nonEmpty(filters.batchIds()),
                nonEmpty(filters.sourceSystems()),
                nonEmpty(filters.documentTypes()),
                nonEmpty(filters.documentNames()),
                nonEmpty(filters.documentStatuses()),
                filters.fromDate(),
                filters.toDate(),
                filters.metadataChips().isEmpty()
                        ? null
                        : filters.metadataChips().stream().map(MetadataChipSelection::toChip).toList(),
                sorts);
    }

    @Nullable
    private static <E> List<E> nonEmpty(List<E> values) {
        return values.isEmpty() ? null : values;
    }
}
