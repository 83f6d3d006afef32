package com.example.dashboard.table.value;

import com.example.dashboard.table.model.SortDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ComparableValues")
class ComparableValuesTest {

    @Test
    @DisplayName("should render null as an empty string")
    void shouldRenderNullAsEmpty() {
        assertThat(ComparableValues.toComparableString(null)).isEmpty();
    }

    @Test
    @DisplayName("should render scalars with their plain text")
    void shouldRenderScalarsAsText() {
        assertThat(ComparableValues.toComparableString("abc")).isEqualTo("abc");
        assertThat(ComparableValues.toComparableString(42)).isEqualTo("42");
        assertThat(ComparableValues.toComparableString(true)).isEqualTo("true");
        assertThat(ComparableValues.toComparableString(SortDirection.DESC)).isEqualTo("DESC");
    }

    @Test
    @DisplayName("should render structures as JSON")
    void shouldRenderStructuresAsJson() {
        assertThat(ComparableValues.toComparableString(Map.of("a", 1))).isEqualTo("{\"a\":1}");
        assertThat(ComparableValues.toComparableString(List.of(1, 2))).isEqualTo("[1,2]");
    }

    @Test
    @DisplayName("should keep null out of search text")
    void shouldKeepNullOutOfSearchText() {
        assertThat(ComparableValues.toSearchableString(null)).isNull();
        assertThat(ComparableValues.toSearchableString(12)).isEqualTo("12");
    }
}
