package com.example.dashboard.table.pagination;

/**
 * Position in a paged result.
 *
 * @param currentPage 1-based page
 * @param pageSize    items per page
 * @param totalItems  items across all pages
 */
public record PaginationState(
        int currentPage,
        int pageSize,
        int totalItems
) {
    public PaginationState {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be at least 1: " + pageSize);
        }
        if (totalItems < 0) totalItems = 0;
    }

    public int totalPages() {
        return PageSlicer.totalPages(totalItems, pageSize);
    }

    /**
     * Same state with the current page moved into {@code [1, totalPages]}.
     */
    public PaginationState clamped() {
        int page = PageSlicer.clampPage(currentPage, totalPages());
        return page == currentPage ? this : new PaginationState(page, pageSize, totalItems);
    }

    public boolean isFirstPage() {
        return currentPage <= 1;
    }

    public boolean isLastPage() {
        return currentPage >= totalPages();
    }
}
