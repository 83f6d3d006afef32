package com.example.dashboard.table.filter;

import com.example.dashboard.table.model.TableColumn;
import com.example.dashboard.table.value.ComparableValues;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Case-insensitive substring match of a query against every declared column.
 */
public final class TextFilter {

    private TextFilter() {}

    /**
     * Keeps the rows where at least one column value contains the query.
     * A blank query returns {@code rows} itself.
     */
    public static <T> List<T> apply(List<T> rows, String query, List<TableColumn<T>> columns) {
        if (query == null || query.isBlank()) {
            return rows;
        }
        String term = query.toLowerCase(Locale.ROOT);
        return rows.stream()
                .filter(row -> matches(row, term, columns))
                .collect(Collectors.toList());
    }

    static <T> boolean matches(T row, String lowerCaseTerm, List<TableColumn<T>> columns) {
        for (TableColumn<T> column : columns) {
            String text = ComparableValues.toSearchableString(column.valueOf(row));
            if (text != null && text.toLowerCase(Locale.ROOT).contains(lowerCaseTerm)) {
                return true;
            }
        }
        return false;
    }
}
