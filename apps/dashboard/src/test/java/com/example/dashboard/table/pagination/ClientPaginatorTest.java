package com.example.dashboard.table.pagination;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientPaginator")
class ClientPaginatorTest {

    private ClientPaginator<Integer> paginator;

    @BeforeEach
    void setUp() {
        paginator = new ClientPaginator<>(IntStream.rangeClosed(1, 25).boxed().toList());
    }

    @Test
    @DisplayName("should start on the first page with the default size")
    void shouldStartOnFirstPage() {
        assertThat(paginator.getPage()).isEqualTo(1);
        assertThat(paginator.getPageSize()).isEqualTo(ClientPaginator.DEFAULT_PAGE_SIZE);
        assertThat(paginator.getTotalPages()).isEqualTo(3);
        assertThat(paginator.pageItems()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        assertThat(paginator.isFirstPage()).isTrue();
    }

    @Test
    @DisplayName("should move between pages within bounds")
    void shouldNavigateWithinBounds() {
        paginator.lastPage();
        assertThat(paginator.pageItems()).containsExactly(21, 22, 23, 24, 25);

        paginator.nextPage();
        assertThat(paginator.getPage()).isEqualTo(3);

        paginator.previousPage();
        paginator.previousPage();
        paginator.previousPage();
        assertThat(paginator.getPage()).isEqualTo(1);

        paginator.goToPage(99);
        assertThat(paginator.getPage()).isEqualTo(3);
    }

    @Test
    @DisplayName("should go back to the first page when the size changes")
    void shouldResetPageOnSizeChange() {
        paginator.goToPage(2);

        paginator.setPageSize(20);

        assertThat(paginator.getPage()).isEqualTo(1);
        assertThat(paginator.getTotalPages()).isEqualTo(2);
    }

    @Test
    @DisplayName("should ignore a non-positive page size")
    void shouldIgnoreNonPositivePageSize() {
        paginator.setPageSize(0);

        assertThat(paginator.getPageSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("should clamp the page when the items shrink")
    void shouldClampWhenItemsShrink() {
        paginator.lastPage();

        paginator.setItems(List.of(1, 2, 3));

        assertThat(paginator.getPage()).isEqualTo(1);
        assertThat(paginator.pageItems()).containsExactly(1, 2, 3);
        assertThat(paginator.info().summary()).isEqualTo("Showing 1 of 1 (3 of 3 results)");
    }
}
