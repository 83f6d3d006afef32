package com.example.dashboard.config.properties;

import com.example.dashboard.table.model.SortDirection;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Defaults stamped onto every table built through the engine factory.
 */
@Validated
@ConfigurationProperties(prefix = "dashboard.table")
public record TableProperties(
        @Min(1) Integer maxSorts,
        @Min(1) Integer maxPageButtons,
        @Min(1) Integer defaultPageSize,
        List<Integer> pageSizeOptions,
        DefaultSort defaultSort,
        Locale locale,
        Duration searchDebounce
) {
    public TableProperties {
        if (maxSorts == null) {
            maxSorts = 3;
        }
        if (maxPageButtons == null) {
            maxPageButtons = 7;
        }
        if (defaultPageSize == null) {
            defaultPageSize = 10;
        }
        if (pageSizeOptions == null || pageSizeOptions.isEmpty()) {
            pageSizeOptions = List.of(10, 20, 50, 100);
        }
        if (defaultSort == null) {
            defaultSort = new DefaultSort("id", SortDirection.DESC);
        }
        if (locale == null) {
            locale = Locale.ENGLISH;
        }
        if (searchDebounce == null) {
            searchDebounce = Duration.ofMillis(300);
        }
    }

    public static TableProperties defaults() {
        return new TableProperties(null, null, null, null, null, null, null);
    }

    public record DefaultSort(
            String column,
            SortDirection direction
    ) {
        public DefaultSort {
            if (column == null || column.isBlank()) {
                column = "id";
            }
            if (direction == null) {
                direction = SortDirection.DESC;
            }
        }
    }
}
