package com.example.dashboard.column;

import com.example.dashboard.table.model.TableColumn;
import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * Factories for the standard column kinds. All of them are sortable; adjust width or
 * sortability with {@link TableColumn#toBuilder()}.
 */
public final class TableColumns {

    public static final String DEFAULT_FALLBACK = "-";
    public static final String STATUS_WIDTH = "140px";

    private TableColumns() {}

    public static <T> TableColumn<T> text(String key, String header) {
        return TableColumn.<T>builder()
                .key(key)
                .header(header)
                .sortable(true)
                .build();
    }

    public static <T> TableColumn<T> numeric(String key, String header) {
        return numeric(key, header, DEFAULT_FALLBACK);
    }

    public static <T> TableColumn<T> numeric(String key, String header, String fallback) {
        return TableColumn.<T>builder()
                .key(key)
                .header(header)
                .sortable(true)
                .render((value, row) -> value == null ? fallback : String.valueOf(value))
                .build();
    }

    public static <T> TableColumn<T> bool(String key, String header) {
        return bool(key, header, "Yes", "No");
    }

    public static <T> TableColumn<T> bool(String key, String header, String trueLabel, String falseLabel) {
        return TableColumn.<T>builder()
                .key(key)
                .header(header)
                .sortable(true)
                .render((value, row) -> isTruthy(value) ? trueLabel : falseLabel)
                .build();
    }

    public static <T> TableColumn<T> date(String key, String header) {
        return TableColumn.<T>builder()
                .key(key)
                .header(header)
                .sortable(true)
                .render((value, row) -> DisplayDates.formatDate(value, DEFAULT_FALLBACK))
                .build();
    }

    public static <T> TableColumn<T> dateTime(String key, String header) {
        return dateTime(key, header, DEFAULT_FALLBACK);
    }

    public static <T> TableColumn<T> dateTime(String key, String header, String fallback) {
        return TableColumn.<T>builder()
                .key(key)
                .header(header)
                .sortable(true)
                .render((value, row) -> DisplayDates.formatDateTime(value, fallback))
                .build();
    }

    /**
     * Renders a {@link StatusBadge} built from the row, ignoring the cell value.
     */
    public static <T> TableColumn<T> status(String key,
                                            String header,
                                            String type,
                                            Function<T, String> getStatus,
                                            @Nullable Function<T, String> getDescription) {
        Objects.requireNonNull(getStatus, "getStatus");
        return TableColumn.<T>builder()
                .key(key)
                .header(header)
                .sortable(true)
                .width(STATUS_WIDTH)
                .render((value, row) -> new StatusBadge(
                        getStatus.apply(row),
                        getDescription != null ? getDescription.apply(row) : null,
                        type))
                .build();
    }

    private static boolean isTruthy(@Nullable Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof CharSequence text) {
            return !text.isEmpty();
        }
        return true;
    }
}
