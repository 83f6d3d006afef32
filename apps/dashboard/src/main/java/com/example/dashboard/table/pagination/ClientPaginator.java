package com.example.dashboard.table.pagination;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Stateful pager over a fully loaded list, used by sub-tables (batches, batch errors)
 * whose rows all arrive in one response.
 */
@Slf4j
public class ClientPaginator<T> {

    public static final int DEFAULT_PAGE_SIZE = 10;

    private List<T> items;
    private int page;
    private int pageSize;

    public ClientPaginator(List<T> items) {
        this(items, 1, DEFAULT_PAGE_SIZE);
    }

    public ClientPaginator(List<T> items, int initialPage, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be at least 1: " + pageSize);
        }
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        this.pageSize = pageSize;
        this.page = initialPage;
    }

    /**
     * Current page, moved into range when the item count shrank underneath it.
     */
    public int getPage() {
        return PageSlicer.clampPage(page, getTotalPages());
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getTotalItems() {
        return items.size();
    }

    public int getTotalPages() {
        return PageSlicer.totalPages(items.size(), pageSize);
    }

    public List<T> pageItems() {
        return PageSlicer.slice(items, getPage(), pageSize);
    }

    public boolean isFirstPage() {
        return getPage() == 1;
    }

    public boolean isLastPage() {
        return getPage() == getTotalPages();
    }

    public PaginationInfo info() {
        return PaginationInfo.of(new PaginationState(getPage(), pageSize, items.size()));
    }

    public void goToPage(int newPage) {
        page = PageSlicer.clampPage(newPage, getTotalPages());
    }

    public void nextPage() {
        if (!isLastPage()) {
            page = getPage() + 1;
        }
    }

    public void previousPage() {
        if (!isFirstPage()) {
            page = getPage() - 1;
        }
    }

    public void firstPage() {
        page = 1;
    }

    public void lastPage() {
        page = getTotalPages();
    }

    public void setPageSize(int size) {
        if (size <= 0) {
            log.warn("Ignoring page size {}", size);
            return;
        }
        pageSize = size;
        page = 1;
    }

    public void setItems(List<T> newItems) {
        items = List.copyOf(Objects.requireNonNull(newItems, "items"));
    }
}
