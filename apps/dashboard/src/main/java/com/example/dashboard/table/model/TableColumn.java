package com.example.dashboard.table.model;

import com.example.dashboard.table.value.NestedValueExtractor;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Column descriptor.
 *
 * @param key      dot path into the row, e.g. {@code documentStatus.refDataValue}
 * @param header   header label
 * @param sortable whether a header click changes the sort
 * @param width    presentation width hint
 * @param render   display transform, never used for comparing or filtering
 */
@Builder(toBuilder = true)
public record TableColumn<T>(
        String key,
        String header,
        boolean sortable,
        @Nullable String width,
        @Nullable ColumnRenderer<T> render
) {
    public TableColumn {
        Objects.requireNonNull(key, "key");
        if (header == null) header = key;
    }

    public static <T> TableColumn<T> of(String key, String header) {
        return new TableColumn<>(key, header, false, null, null);
    }

    public static <T> TableColumn<T> sortable(String key, String header) {
        return new TableColumn<>(key, header, true, null, null);
    }

    @Nullable
    public Object valueOf(T row) {
        return NestedValueExtractor.extract(row, key);
    }

    @Nullable
    public Object display(T row) {
        Object value = valueOf(row);
        return render != null ? render.render(value, row) : value;
    }

    @FunctionalInterface
    public interface ColumnRenderer<T> {
        @Nullable
        Object render(@Nullable Object value, T row);
    }
}
