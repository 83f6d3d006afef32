package com.example.dashboard.documentrequest.service;

import com.example.dashboard.documentrequest.model.request.SortItem;
import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.TableColumn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converts between table sort entries, keyed by column path, and API sort items, keyed by
 * top-level property. {@code documentStatus.refDataValue} sorts as {@code documentStatus}.
 */
public final class SortItems {

    private SortItems() {}

    public static List<SortItem> toSortItems(List<SortEntry> entries) {
        return entries.stream()
                .sorted(Comparator.comparingInt(SortEntry::priority))
                .map(entry -> new SortItem(propertyOf(entry.column()), entry.direction()))
                .toList();
    }

    /**
     * Maps each item back to the first column whose path starts with its property, or to the
     * bare property when no column matches.
     */
    public static <T> List<SortEntry> toSortEntries(List<SortItem> items, List<TableColumn<T>> columns) {
        List<SortEntry> entries = new ArrayList<>(items.size());
        for (SortItem item : items) {
            String column = columns.stream()
                    .map(TableColumn::key)
                    .filter(key -> propertyOf(key).equals(item.property()))
                    .findFirst()
                    .orElse(item.property());
            entries.add(SortEntry.of(column, item.direction(), entries.size()));
        }
        return List.copyOf(entries);
    }

    public static String propertyOf(String columnKey) {
        int dot = columnKey.indexOf('.');
        return dot < 0 ? columnKey : columnKey.substring(0, dot);
    }
}
