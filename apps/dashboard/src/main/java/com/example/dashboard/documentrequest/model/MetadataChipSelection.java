package com.example.dashboard.documentrequest.model;

import com.example.dashboard.documentrequest.model.request.MetadataChip;

/**
 * Metadata filter chip as picked in the filter panel. The label is for display only.
 */
public record MetadataChipSelection(
        Long keyId,
        String keyLabel,
        String value
) {
    public MetadataChip toChip() {
        return new MetadataChip(keyId, value);
    }
}
