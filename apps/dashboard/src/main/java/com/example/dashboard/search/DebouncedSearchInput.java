package com.example.dashboard.search;

import com.example.dashboard.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Search box state. Keystrokes update the local text at once and reach {@code onChange} only
 * after the text has been stable for the debounce window, and only when it differs from the
 * last committed value. Clearing commits immediately.
 */
@Slf4j
public class DebouncedSearchInput implements Disposable {

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(300);

    private final Consumer<String> onChange;
    private final Runnable onSearch;
    private final Sinks.Many<String> keystrokes = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable subscription;

    private volatile String localValue;
    private volatile String committedValue;

    public DebouncedSearchInput(String initialValue, Consumer<String> onChange) {
        this(initialValue, DEFAULT_DEBOUNCE, onChange, null, Schedulers.parallel());
    }

    public DebouncedSearchInput(String initialValue,
                                Duration debounce,
                                Consumer<String> onChange,
                                @Nullable Runnable onSearch,
                                Scheduler scheduler) {
        this.onChange = Objects.requireNonNull(onChange, "onChange");
        this.onSearch = onSearch;
        this.localValue = initialValue == null ? "" : initialValue;
        this.committedValue = this.localValue;
        Duration window = debounce == null || debounce.isNegative() ? DEFAULT_DEBOUNCE : debounce;
        this.subscription = keystrokes.asFlux()
                .sampleTimeout(text -> Mono.delay(window, scheduler))
                .filter(text -> !text.equals(committedValue))
                .subscribe(this::commit, error -> log.error("Search input stopped", error));
    }

    public void type(String text) {
        localValue = text == null ? "" : text;
        keystrokes.tryEmitNext(localValue);
    }

    /**
     * Empties the box, commits the empty value without waiting and triggers a search.
     */
    public void clear() {
        localValue = "";
        keystrokes.tryEmitNext("");
        commit("");
        if (onSearch != null) {
            onSearch.run();
        }
    }

    public void pressEnter() {
        if (onSearch != null) {
            onSearch.run();
        }
    }

    /**
     * Adopts a value set from outside, e.g. when the owner resets its filter.
     */
    public void sync(String value) {
        String synced = value == null ? "" : value;
        committedValue = synced;
        localValue = synced;
    }

    public String getValue() {
        return localValue;
    }

    public String getCommittedValue() {
        return committedValue;
    }

    public boolean showClearButton(boolean loading, boolean disabled) {
        return !localValue.isEmpty() && !loading && !disabled;
    }

    @Override
    public void dispose() {
        subscription.dispose();
        keystrokes.tryEmitComplete();
    }

    @Override
    public boolean isDisposed() {
        return subscription.isDisposed();
    }

    private void commit(String text) {
        log.debug("Search text committed: '{}'", StringSanitizer.forLog(text));
        committedValue = text;
        onChange.accept(text);
    }
}
