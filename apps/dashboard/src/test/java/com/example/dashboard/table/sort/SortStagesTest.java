package com.example.dashboard.table.sort;

import com.example.dashboard.table.model.OperatingMode;
import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.SortState;
import com.example.dashboard.table.value.ValueComparator;
import com.example.dashboard.util.Person;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.example.dashboard.table.model.SortDirection.ASC;
import static com.example.dashboard.table.model.SortDirection.DESC;
import static com.example.dashboard.util.PersonTestBuilder.aPerson;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SortStages")
class SortStagesTest {

    private final ValueComparator values = new ValueComparator(Locale.ENGLISH);

    private final List<Person> people = List.of(
            aPerson().withId(1L).withName("carol").withAge(30).withCity("Paris").build(),
            aPerson().withId(2L).withName("Alice").withAge(null).withCity("London").build(),
            aPerson().withId(3L).withName("bob").withAge(30).withCity("Berlin").build(),
            aPerson().withId(4L).withName("Dave").withAge(25).withCity("London").build());

    @Nested
    @DisplayName("single column")
    class SingleColumn {

        @Test
        @DisplayName("should sort strings ignoring case")
        void shouldSortStringsIgnoringCase() {
            SingleSortConfig config = SingleSortConfig.builder().column("name").direction(ASC).build();

            assertThat(SortStages.<Person>forConfig(config, values).apply(people))
                    .extracting(Person::name)
                    .containsExactly("Alice", "bob", "carol", "Dave");
        }

        @Test
        @DisplayName("should keep nulls last when descending")
        void shouldKeepNullsLastWhenDescending() {
            SingleSortConfig config = SingleSortConfig.builder().column("age").direction(DESC).build();

            assertThat(SortStages.<Person>forConfig(config, values).apply(people))
                    .extracting(Person::id)
                    .containsExactly(1L, 3L, 4L, 2L);
        }

        @Test
        @DisplayName("should sort by a nested path")
        void shouldSortByNestedPath() {
            SingleSortConfig config = SingleSortConfig.builder().column("address.city").direction(ASC).build();

            assertThat(SortStages.<Person>forConfig(config, values).apply(people))
                    .extracting(Person::id)
                    .containsExactly(3L, 2L, 4L, 1L);
        }

        @Test
        @DisplayName("should leave rows untouched when unsorted")
        void shouldPassThroughWhenUnsorted() {
            SingleSortConfig config = SingleSortConfig.builder().build().withState(SortState.UNSORTED);

            assertThat(SortStages.<Person>forConfig(config, values).apply(people)).isSameAs(people);
        }
    }

    @Nested
    @DisplayName("multi column")
    class MultiColumn {

        @Test
        @DisplayName("should break ties with lower priorities")
        void shouldBreakTiesWithLowerPriorities() {
            MultiSortConfig config = MultiSortConfig.builder()
                    .sorts(List.of(SortEntry.of("address.city", ASC, 0), SortEntry.of("age", DESC, 1)))
                    .build();

            assertThat(SortStages.<Person>forConfig(config, values).apply(people))
                    .extracting(Person::id)
                    .containsExactly(3L, 4L, 2L, 1L);
        }

        @Test
        @DisplayName("should keep incoming order for complete ties")
        void shouldBeStable() {
            MultiSortConfig config = MultiSortConfig.builder()
                    .sorts(List.of(SortEntry.of("age", DESC, 0)))
                    .build();

            assertThat(SortStages.<Person>forConfig(config, values).apply(people))
                    .extracting(Person::id)
                    .containsExactly(1L, 3L, 4L, 2L);
        }

        @Test
        @DisplayName("should pass rows through for an empty or missing sort list")
        void shouldPassThroughForEmptyOrMissingSorts() {
            MultiSortConfig empty = MultiSortConfig.builder().sorts(List.of()).build();
            MultiSortConfig missing = MultiSortConfig.builder().build();

            assertThat(SortStages.<Person>forConfig(empty, values).apply(people)).isSameAs(people);
            assertThat(SortStages.<Person>forConfig(missing, values).apply(people)).isSameAs(people);
        }
    }

    @Test
    @DisplayName("should pass rows through in server mode")
    void shouldPassThroughInServerMode() {
        SingleSortConfig config = SingleSortConfig.builder()
                .column("name")
                .direction(ASC)
                .mode(OperatingMode.SERVER)
                .build();

        assertThat(SortStages.<Person>forConfig(config, values).apply(people)).isSameAs(people);
    }

    @Test
    @DisplayName("should not modify the input list")
    void shouldNotModifyInput() {
        List<Person> input = new ArrayList<>(people);
        SingleSortConfig config = SingleSortConfig.builder().column("name").direction(ASC).build();

        SortStages.<Person>forConfig(config, values).apply(input);

        assertThat(input).containsExactlyElementsOf(people);
    }
}
