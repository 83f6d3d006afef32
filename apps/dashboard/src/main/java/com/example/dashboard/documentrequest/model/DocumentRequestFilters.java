package com.example.dashboard.documentrequest.model;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Filter panel state for the document request search.
 *
 * @param fromDate ISO date ({@code yyyy-MM-dd}), null when unset
 * @param toDate   ISO date ({@code yyyy-MM-dd}), null when unset
 */
@Builder(toBuilder = true)
public record DocumentRequestFilters(
        List<Long> requestIds,
        List<Long> batchIds,
        List<Long> sourceSystems,
        List<Long> documentTypes,
        List<Long> documentNames,
        List<Long> documentStatuses,
        @Nullable String fromDate,
        @Nullable String toDate,
        List<MetadataChipSelection> metadataChips
) {
    public DocumentRequestFilters {
        requestIds = copy(requestIds);
        batchIds = copy(batchIds);
        sourceSystems = copy(sourceSystems);
        documentTypes = copy(documentTypes);
        documentNames = copy(documentNames);
        documentStatuses = copy(documentStatuses);
        metadataChips = copy(metadataChips);
        if (fromDate != null && fromDate.isBlank()) fromDate = null;
        if (toDate != null && toDate.isBlank()) toDate = null;
    }

    public static DocumentRequestFilters empty() {
        return DocumentRequestFilters.builder().build();
    }

    public boolean isEmpty() {
        return requestIds.isEmpty()
                && batchIds.isEmpty()
                && sourceSystems.isEmpty()
                && documentTypes.isEmpty()
                && documentNames.isEmpty()
                && documentStatuses.isEmpty()
                && fromDate == null
                && toDate == null
                && metadataChips.isEmpty();
    }

    private static <E> List<E> copy(@Nullable List<E> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
