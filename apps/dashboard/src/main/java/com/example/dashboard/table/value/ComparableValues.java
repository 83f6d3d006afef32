package com.example.dashboard.table.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * String forms of cell values used when two values have no common natural order.
 */
@Slf4j
public final class ComparableValues {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private ComparableValues() {}

    /**
     * Converts a value to the string used for fallback comparison.
     * Null becomes the empty string, scalars use their text form and
     * any other object is rendered as JSON.
     */
    @NonNull
    public static String toComparableString(@Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Falling back to toString for {}: {}", value.getClass().getName(), e.getMessage());
            return String.valueOf(value);
        }
    }

    /**
     * Text used by the free-text filter. Null has no text.
     */
    @Nullable
    public static String toSearchableString(@Nullable Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
