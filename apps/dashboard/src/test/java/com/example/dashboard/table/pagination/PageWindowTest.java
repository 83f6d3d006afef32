package com.example.dashboard.table.pagination;

import com.example.dashboard.table.pagination.PageItem.EllipsisPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.dashboard.table.pagination.PageItem.ellipsis;
import static com.example.dashboard.table.pagination.PageItem.page;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PageWindow")
class PageWindowTest {

    @Test
    @DisplayName("should list every page when they fit")
    void shouldListEveryPageWhenTheyFit() {
        assertThat(PageWindow.compute(1, 5, 7)).containsExactly(page(1), page(2), page(3), page(4), page(5));
        assertThat(PageWindow.compute(1, 1, 7)).containsExactly(page(1));
    }

    @Test
    @DisplayName("should centre the window with ellipses on both sides")
    void shouldCentreWindow() {
        assertThat(PageWindow.compute(10, 20, 7)).containsExactly(
                page(1),
                ellipsis(EllipsisPosition.START),
                page(8), page(9), page(10), page(11), page(12),
                ellipsis(EllipsisPosition.END),
                page(20));
    }

    @Test
    @DisplayName("should anchor the window to the start near the first page")
    void shouldAnchorToStart() {
        assertThat(PageWindow.compute(2, 20, 7)).containsExactly(
                page(1), page(2), page(3), page(4), page(5),
                ellipsis(EllipsisPosition.END),
                page(20));
    }

    @Test
    @DisplayName("should anchor the window to the end near the last page")
    void shouldAnchorToEnd() {
        assertThat(PageWindow.compute(19, 20, 7)).containsExactly(
                page(1),
                ellipsis(EllipsisPosition.START),
                page(16), page(17), page(18), page(19), page(20));
    }

    @Test
    @DisplayName("should always include the first, last and current page")
    void shouldIncludeFirstLastAndCurrent() {
        for (int current = 1; current <= 50; current++) {
            List<PageItem> items = PageWindow.compute(current, 50, 7);

            assertThat(items.get(0)).isEqualTo(page(1));
            assertThat(items.get(items.size() - 1)).isEqualTo(page(50));
            assertThat(items).contains(page(current));
        }
    }

    @Test
    @DisplayName("should default to seven buttons")
    void shouldDefaultToSevenButtons() {
        assertThat(PageWindow.compute(10, 20)).isEqualTo(PageWindow.compute(10, 20, 7));
    }
}
