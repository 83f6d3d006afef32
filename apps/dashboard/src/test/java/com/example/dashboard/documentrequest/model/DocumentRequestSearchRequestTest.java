package com.example.dashboard.documentrequest.model;

import com.example.dashboard.documentrequest.model.request.DocumentRequestSearchRequest;
import com.example.dashboard.documentrequest.model.request.SortItem;
import com.example.dashboard.table.model.SortDirection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentRequestSearchRequest")
class DocumentRequestSearchRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should send only the sorts for empty filters")
    void shouldSendOnlySortsForEmptyFilters() {
        DocumentRequestSearchRequest request = DocumentRequestSearchRequest.from(
                DocumentRequestFilters.empty(), List.of(new SortItem("id", SortDirection.DESC)));

        JsonNode json = objectMapper.valueToTree(request);

        assertThat(json.size()).isEqualTo(1);
        assertThat(json.get("sorts").get(0).get("property").asText()).isEqualTo("id");
        assertThat(json.get("sorts").get(0).get("direction").asText()).isEqualTo("DESC");
    }

    @Test
    @DisplayName("should always send the sorts, even when empty")
    void shouldAlwaysSendSorts() {
        DocumentRequestSearchRequest request = DocumentRequestSearchRequest.from(DocumentRequestFilters.empty(), null);

        JsonNode json = objectMapper.valueToTree(request);

        assertThat(json.has("sorts")).isTrue();
        assertThat(json.get("sorts").isArray()).isTrue();
        assertThat(json.get("sorts").size()).isZero();
    }

    @Test
    @DisplayName("should send the filters that are set")
    void shouldSendFiltersThatAreSet() {
        DocumentRequestFilters filters = DocumentRequestFilters.builder()
                .documentStatuses(List.of(1L, 2L))
                .fromDate("2025-01-01")
                .toDate(" ")
                .metadataChips(List.of(new MetadataChipSelection(7L, "Account", "A-100")))
                .build();

        JsonNode json = objectMapper.valueToTree(DocumentRequestSearchRequest.from(filters, List.of()));

        assertThat(json.get("documentStatuses").toString()).isEqualTo("[1,2]");
        assertThat(json.get("fromDate").asText()).isEqualTo("2025-01-01");
        assertThat(json.has("toDate")).isFalse();
        assertThat(json.has("requestIds")).isFalse();
        assertThat(json.get("metadataChips").get(0).get("keyId").asLong()).isEqualTo(7L);
        assertThat(json.get("metadataChips").get(0).get("value").asText()).isEqualTo("A-100");
        assertThat(json.get("metadataChips").get(0).has("keyLabel")).isFalse();
    }

    @Test
    @DisplayName("should treat missing lists and blank dates as empty filters")
    void shouldNormalizeFilters() {
        DocumentRequestFilters filters = new DocumentRequestFilters(null, null, null, null, null, null, "", null, null);

        assertThat(filters.isEmpty()).isTrue();
        assertThat(filters.requestIds()).isEmpty();
        assertThat(filters.toBuilder().batchIds(List.of(5L)).build().isEmpty()).isFalse();
    }
}
