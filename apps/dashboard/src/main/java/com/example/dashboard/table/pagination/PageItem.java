package com.example.dashboard.table.pagination;

/**
 * Entry of the page-button bar: a page number or an ellipsis for a skipped range.
 */
public sealed interface PageItem permits PageItem.Page, PageItem.Ellipsis {

    enum EllipsisPosition {
        START,
        END
    }

    record Page(int number) implements PageItem {}

    record Ellipsis(EllipsisPosition position) implements PageItem {}

    static PageItem page(int number) {
        return new Page(number);
    }

    static PageItem ellipsis(EllipsisPosition position) {
        return new Ellipsis(position);
    }
}
