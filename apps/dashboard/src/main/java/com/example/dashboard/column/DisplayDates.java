package com.example.dashboard.column;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;

/**
 * Date formatting for table cells. Everything is rendered in UTC.
 */
@Slf4j
public final class DisplayDates {

    private static final DateTimeFormatter DATE = DateTimeFormatter
            .ofPattern("dd MMM yyyy", Locale.UK)
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter
            .ofPattern("dd MMM yyyy, HH:mm", Locale.UK)
            .withZone(ZoneOffset.UTC);

    private DisplayDates() {}

    /**
     * Formats as {@code 28 Dec 2025}.
     */
    public static String formatDate(@Nullable Object value, String fallback) {
        Instant instant = toInstant(value);
        return instant == null ? fallback : DATE.format(instant);
    }

    /**
     * Formats as {@code 28 Dec 2025, 14:30}.
     */
    public static String formatDateTime(@Nullable Object value, String fallback) {
        Instant instant = toInstant(value);
        return instant == null ? fallback : DATE_TIME.format(instant);
    }

    /**
     * Reads dates, temporals, epoch milliseconds and ISO-8601 strings. Zone-less values are
     * taken as UTC. Anything else is null.
     */
    @Nullable
    public static Instant toInstant(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime());
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof TemporalAccessor temporal) {
            return fromTemporal(temporal);
        }
        if (value instanceof CharSequence text) {
            return parse(text.toString().trim());
        }
        return null;
    }

    @Nullable
    private static Instant fromTemporal(TemporalAccessor temporal) {
        if (temporal instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (temporal instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (temporal instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        if (temporal instanceof LocalDate localDate) {
            return localDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return null;
    }

    @Nullable
    private static Instant parse(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            TemporalAccessor parsed = text.indexOf('T') < 0
                    ? LocalDate.parse(text)
                    : DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            return fromTemporal(parsed);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date value: {}", text);
            return null;
        }
    }
}
