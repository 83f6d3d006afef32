package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.SortDirection;
import com.example.dashboard.table.model.SortEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.dashboard.table.model.SortDirection.ASC;
import static com.example.dashboard.table.model.SortDirection.DESC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MultiSortController")
class MultiSortControllerTest {

    private static final List<SortEntry> DEFAULTS = List.of(SortEntry.of("id", DESC, 0));

    private List<List<SortEntry>> notifications;
    private MultiSortController controller;

    @BeforeEach
    void setUp() {
        notifications = new ArrayList<>();
        controller = new MultiSortController(3, DESC, DEFAULTS, List.of(), notifications::add);
    }

    @Nested
    @DisplayName("toggle")
    class Toggle {

        @Test
        @DisplayName("should add a new column with the initial direction at the lowest priority")
        void shouldAddNewColumn() {
            controller.toggle("name");
            List<SortEntry> sorts = controller.toggle("age");

            assertThat(sorts).containsExactly(
                    SortEntry.of("name", DESC, 0),
                    SortEntry.of("age", DESC, 1));
        }

        @Test
        @DisplayName("should flip a column in place, then remove it")
        void shouldFlipThenRemove() {
            controller.toggle("name");
            controller.toggle("age");

            assertThat(controller.toggle("name")).containsExactly(
                    SortEntry.of("name", ASC, 0),
                    SortEntry.of("age", DESC, 1));
            assertThat(controller.toggle("name")).containsExactly(SortEntry.of("age", DESC, 0));
        }

        @Test
        @DisplayName("should evict the primary entry when the depth is exceeded")
        void shouldEvictPrimaryWhenFull() {
            controller.toggle("a");
            controller.toggle("b");
            controller.toggle("c");

            List<SortEntry> sorts = controller.toggle("d");

            assertThat(sorts).extracting(SortEntry::column).containsExactly("b", "c", "d");
            assertThat(sorts).extracting(SortEntry::priority).containsExactly(0, 1, 2);
        }

        @Test
        @DisplayName("should restore the default sort when the last column is removed")
        void shouldRestoreDefaultWhenEmpty() {
            controller.toggle("name");
            controller.toggle("name");

            assertThat(controller.toggle("name")).isEqualTo(DEFAULTS);
        }

        @Test
        @DisplayName("should notify the listener after each change")
        void shouldNotifyListener() {
            controller.toggle("name");
            controller.toggle("name");

            assertThat(notifications).hasSize(2);
            assertThat(notifications.get(1)).containsExactly(SortEntry.of("name", ASC, 0));
        }
    }

    @Nested
    @DisplayName("setSort and removeSort")
    class SetAndRemove {

        @Test
        @DisplayName("should replace the last entry when adding at capacity")
        void shouldReplaceLastAtCapacity() {
            controller.toggle("a");
            controller.toggle("b");
            controller.toggle("c");

            assertThat(controller.setSort("d", ASC)).containsExactly(
                    SortEntry.of("a", DESC, 0),
                    SortEntry.of("b", DESC, 1),
                    SortEntry.of("d", ASC, 2));
        }

        @Test
        @DisplayName("should change the direction of an existing column")
        void shouldChangeExistingDirection() {
            controller.toggle("a");

            assertThat(controller.setSort("a", ASC)).containsExactly(SortEntry.of("a", ASC, 0));
        }

        @Test
        @DisplayName("should renumber after removing a column")
        void shouldRenumberAfterRemove() {
            controller.toggle("a");
            controller.toggle("b");
            controller.toggle("c");

            assertThat(controller.removeSort("a")).containsExactly(
                    SortEntry.of("b", DESC, 0),
                    SortEntry.of("c", DESC, 1));
        }

        @Test
        @DisplayName("should fall back to defaults on clear")
        void shouldFallBackToDefaultsOnClear() {
            controller.toggle("a");

            assertThat(controller.clearSorts()).isEqualTo(DEFAULTS);
            assertThat(controller.resetToDefault()).isEqualTo(DEFAULTS);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("should report direction and 1-based position")
        void shouldReportDirectionAndPosition() {
            controller.toggle("a");
            controller.toggle("b");

            assertThat(controller.directionOf("b")).isEqualTo(DESC);
            assertThat(controller.sortIndexOf("b")).isEqualTo(2);
            assertThat(controller.directionOf("z")).isNull();
            assertThat(controller.sortIndexOf("z")).isEqualTo(-1);
            assertThat(controller.primary()).contains(SortEntry.of("a", DESC, 0));
        }

        @Test
        @DisplayName("should start from the defaults when no sorts are given")
        void shouldStartFromDefaults() {
            MultiSortController fresh = new MultiSortController();

            assertThat(fresh.sorts()).isEqualTo(MultiSortConfig.DEFAULT_SORTS);
            assertThat(fresh.getMaxSorts()).isEqualTo(3);
        }

        @Test
        @DisplayName("should normalize priorities of the initial sorts")
        void shouldNormalizeInitialSorts() {
            MultiSortController fromConfig = MultiSortController.forConfig(MultiSortConfig.builder()
                    .sorts(List.of(SortEntry.of("b", ASC, 5), SortEntry.of("a", DESC, 2)))
                    .build());

            assertThat(fromConfig.sorts()).containsExactly(
                    SortEntry.of("a", DESC, 0),
                    SortEntry.of("b", ASC, 1));
        }

        @Test
        @DisplayName("should reject a depth below one")
        void shouldRejectZeroDepth() {
            assertThatThrownBy(() -> new MultiSortController(0, SortDirection.DESC, DEFAULTS, null, s -> {}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
