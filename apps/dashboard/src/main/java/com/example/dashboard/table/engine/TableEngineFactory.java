package com.example.dashboard.table.engine;

import com.example.dashboard.config.properties.TableProperties;
import com.example.dashboard.search.DebouncedSearchInput;
import com.example.dashboard.table.filter.FilterConfig;
import com.example.dashboard.table.model.SortEntry;
import com.example.dashboard.table.model.TableColumn;
import com.example.dashboard.table.pagination.PaginationConfig;
import com.example.dashboard.table.sort.MultiSortConfig;
import com.example.dashboard.table.sort.SingleSortConfig;
import com.example.dashboard.table.value.ValueComparator;
import org.springframework.lang.Nullable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.function.Consumer;

/**
 * Builders preset with the configured table defaults. Callers override any field before
 * {@code build()}.
 */
public class TableEngineFactory {

    private final TableProperties properties;
    private final ValueComparator valueComparator;
    private final Scheduler debounceScheduler;

    public TableEngineFactory(TableProperties properties) {
        this(properties, Schedulers.parallel());
    }

    public TableEngineFactory(TableProperties properties, Scheduler debounceScheduler) {
        this.properties = properties;
        this.valueComparator = new ValueComparator(properties.locale());
        this.debounceScheduler = debounceScheduler;
    }

    public <T> PaginatedDataTable.PaginatedDataTableBuilder<T> table(List<T> data, List<TableColumn<T>> columns) {
        return PaginatedDataTable.<T>builder()
                .data(data)
                .columns(columns)
                .valueComparator(valueComparator);
    }

    public FilterConfig.FilterConfigBuilder filter() {
        return FilterConfig.builder()
                .value("")
                .debounceMs((int) properties.searchDebounce().toMillis());
    }

    public SingleSortConfig.SingleSortConfigBuilder singleSort() {
        return SingleSortConfig.builder();
    }

    /**
     * Multi-column sort starting from, and resetting to, the configured default sort.
     */
    public MultiSortConfig.MultiSortConfigBuilder multiSort() {
        List<SortEntry> defaults = List.of(defaultSort());
        return MultiSortConfig.builder()
                .sorts(defaults)
                .defaultSorts(defaults)
                .maxSorts(properties.maxSorts());
    }

    public PaginationConfig.PaginationConfigBuilder pagination() {
        return PaginationConfig.builder()
                .currentPage(1)
                .pageSize(properties.defaultPageSize())
                .pageSizeOptions(properties.pageSizeOptions())
                .maxPageButtons(properties.maxPageButtons());
    }

    public DebouncedSearchInput searchInput(String initialValue,
                                            Consumer<String> onChange,
                                            @Nullable Runnable onSearch) {
        return new DebouncedSearchInput(initialValue, properties.searchDebounce(), onChange, onSearch,
                debounceScheduler);
    }

    public SortEntry defaultSort() {
        TableProperties.DefaultSort sort = properties.defaultSort();
        return SortEntry.of(sort.column(), sort.direction(), 0);
    }

    public ValueComparator getValueComparator() {
        return valueComparator;
    }

    public TableProperties getProperties() {
        return properties;
    }
}
