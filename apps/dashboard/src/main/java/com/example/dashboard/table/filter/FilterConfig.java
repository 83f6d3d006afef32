package com.example.dashboard.table.filter;

import com.example.dashboard.table.model.OperatingMode;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.function.Consumer;

/**
 * Opt-in free-text filter.
 *
 * @param value       current query
 * @param onChange    called with every new query, in both modes
 * @param onSearch    explicit search trigger (enter key, clear button)
 * @param placeholder input placeholder
 * @param debounceMs  input debounce in milliseconds
 * @param mode        {@link OperatingMode#CLIENT} by default
 */
@Builder(toBuilder = true)
public record FilterConfig(
        @Nullable String value,
        @Nullable Consumer<String> onChange,
        @Nullable Runnable onSearch,
        String placeholder,
        int debounceMs,
        boolean loading,
        boolean disabled,
        OperatingMode mode
) {
    public static final String DEFAULT_PLACEHOLDER = "Search...";
    public static final int DEFAULT_DEBOUNCE_MS = 300;

    public FilterConfig {
        if (placeholder == null || placeholder.isBlank()) placeholder = DEFAULT_PLACEHOLDER;
        if (debounceMs <= 0) debounceMs = DEFAULT_DEBOUNCE_MS;
        mode = OperatingMode.orDefault(mode);
    }

    public static FilterConfig client(String value, Consumer<String> onChange) {
        return FilterConfig.builder().value(value).onChange(onChange).mode(OperatingMode.CLIENT).build();
    }

    public static FilterConfig server(String value, Consumer<String> onChange) {
        return FilterConfig.builder().value(value).onChange(onChange).mode(OperatingMode.SERVER).build();
    }

    public FilterConfig withValue(String newValue) {
        return toBuilder().value(newValue).build();
    }
}
