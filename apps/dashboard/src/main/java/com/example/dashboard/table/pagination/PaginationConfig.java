package com.example.dashboard.table.pagination;

import com.example.dashboard.table.model.OperatingMode;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.function.IntConsumer;

/**
 * Opt-in pagination. In {@link OperatingMode#SERVER} mode {@code totalItems} is the server
 * total and the rows handed to the table are already the current page.
 */
@Builder(toBuilder = true)
public record PaginationConfig(
        int currentPage,
        int totalItems,
        int pageSize,
        @Nullable IntConsumer onPageChange,
        @Nullable IntConsumer onPageSizeChange,
        List<Integer> pageSizeOptions,
        Boolean showPageSizeSelector,
        Boolean showInfo,
        int maxPageButtons,
        OperatingMode mode
) {
    public static final List<Integer> DEFAULT_PAGE_SIZE_OPTIONS = List.of(10, 20, 50, 100);

    public PaginationConfig {
        if (currentPage < 1) currentPage = 1;
        if (totalItems < 0) totalItems = 0;
        pageSizeOptions = pageSizeOptions == null || pageSizeOptions.isEmpty()
                ? DEFAULT_PAGE_SIZE_OPTIONS
                : List.copyOf(pageSizeOptions);
        if (showPageSizeSelector == null) showPageSizeSelector = Boolean.TRUE;
        if (showInfo == null) showInfo = Boolean.TRUE;
        if (maxPageButtons <= 0) maxPageButtons = PageWindow.DEFAULT_MAX_BUTTONS;
        mode = OperatingMode.orDefault(mode);
    }

    public PaginationConfig withCurrentPage(int page) {
        return toBuilder().currentPage(page).build();
    }

    public PaginationConfig withPageSize(int size) {
        return toBuilder().pageSize(size).currentPage(1).build();
    }

    /**
     * Page size selector is only useful when someone listens to size changes.
     */
    public boolean pageSizeSelectorVisible() {
        return showPageSizeSelector && onPageSizeChange != null;
    }
}
