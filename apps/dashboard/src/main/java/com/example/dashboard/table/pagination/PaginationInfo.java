package com.example.dashboard.table.pagination;

/**
 * Item range and navigation flags of the current page.
 */
public record PaginationInfo(
        int currentPage,
        int totalPages,
        int pageSize,
        int totalItems,
        int startItem,
        int endItem,
        boolean hasPrevious,
        boolean hasNext
) {
    public static PaginationInfo of(PaginationState state) {
        int page = state.currentPage();
        int size = state.pageSize();
        int total = state.totalItems();
        int totalPages = state.totalPages();
        return new PaginationInfo(
                page,
                totalPages,
                size,
                total,
                (int) Math.min((long) (page - 1) * size + 1, total),
                (int) Math.min((long) page * size, total),
                page > 1,
                page < totalPages);
    }

    public String summary() {
        return "Showing " + currentPage + " of " + totalPages + " (" + endItem + " of " + totalItems + " results)";
    }
}
