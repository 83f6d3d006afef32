package com.example.dashboard.table.pagination;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses which page buttons to show when there are more pages than buttons.
 * <p>
 * The first and last pages are always shown, the window around the current page is
 * anchored to either end when the current page is close to it, and skipped ranges
 * collapse into an ellipsis.
 */
public final class PageWindow {

    public static final int DEFAULT_MAX_BUTTONS = 7;

    private PageWindow() {}

    public static List<PageItem> compute(int currentPage, int totalPages) {
        return compute(currentPage, totalPages, DEFAULT_MAX_BUTTONS);
    }

    public static List<PageItem> compute(int currentPage, int totalPages, int maxButtons) {
        List<PageItem> pages = new ArrayList<>();
        if (totalPages <= maxButtons) {
            for (int page = 1; page <= totalPages; page++) {
                pages.add(PageItem.page(page));
            }
            return List.copyOf(pages);
        }

        // first, last and one ellipsis are reserved
        int half = Math.floorDiv(maxButtons - 3, 2);

        pages.add(PageItem.page(1));

        int start = Math.max(2, currentPage - half);
        int end = Math.min(totalPages - 1, currentPage + half);

        if (currentPage <= half + 2) {
            end = Math.min(totalPages - 1, maxButtons - 2);
        }
        if (currentPage >= totalPages - half - 1) {
            start = Math.max(2, totalPages - maxButtons + 3);
        }

        if (start > 2) {
            pages.add(PageItem.ellipsis(PageItem.EllipsisPosition.START));
        }
        for (int page = start; page <= end; page++) {
            pages.add(PageItem.page(page));
        }
        if (end < totalPages - 1) {
            pages.add(PageItem.ellipsis(PageItem.EllipsisPosition.END));
        }
        if (totalPages > 1) {
            pages.add(PageItem.page(totalPages));
        }
        return List.copyOf(pages);
    }
}
