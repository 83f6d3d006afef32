package com.example.dashboard.table.pagination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Page arithmetic on 1-based page numbers.
 */
public final class PageSlicer {

    private PageSlicer() {}

    /**
     * Number of pages for a result, never less than one.
     */
    public static int totalPages(int totalItems, int pageSize) {
        if (pageSize <= 0 || totalItems <= 0) {
            return 1;
        }
        return Math.max(1, (int) Math.ceil((double) totalItems / pageSize));
    }

    public static int clampPage(int page, int totalPages) {
        return Math.min(Math.max(1, page), Math.max(1, totalPages));
    }

    /**
     * Items of {@code page}, i.e. {@code items[(page-1)*pageSize, page*pageSize)} bounded by the list.
     */
    public static <T> List<T> slice(List<T> items, int page, int pageSize) {
        if (pageSize <= 0) {
            return items;
        }
        long from = (long) (Math.max(1, page) - 1) * pageSize;
        int fromIndex = (int) Math.min(from, items.size());
        int toIndex = (int) Math.min(from + pageSize, items.size());
        return Collections.unmodifiableList(new ArrayList<>(items.subList(fromIndex, toIndex)));
    }
}
