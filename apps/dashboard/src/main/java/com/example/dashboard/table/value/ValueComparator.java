package com.example.dashboard.table.value;

import com.example.dashboard.table.model.SortDirection;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.Collator;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.chrono.ChronoLocalDate;
import java.time.chrono.ChronoLocalDateTime;
import java.util.Comparator;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;

/**
 * Type-aware comparison of two extracted cell values, returning -1, 0 or 1.
 * <ol>
 *   <li>two nulls are equal</li>
 *   <li>a null is greater than any non-null value, whatever the sort direction</li>
 *   <li>strings use locale collation, ignoring case and accents</li>
 *   <li>numbers compare arithmetically</li>
 *   <li>dates compare by instant</li>
 *   <li>anything else compares by {@link ComparableValues#toComparableString}</li>
 * </ol>
 */
public final class ValueComparator implements Comparator<Object> {

    private static final ValueComparator DEFAULT = new ValueComparator(Locale.getDefault());

    private final Locale locale;
    private final Collator collator;

    public ValueComparator(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
        this.collator = Collator.getInstance(locale);
        this.collator.setStrength(Collator.PRIMARY);
    }

    public static ValueComparator defaultComparator() {
        return DEFAULT;
    }

    public Locale getLocale() {
        return locale;
    }

    @Override
    public int compare(@Nullable Object a, @Nullable Object b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        if (a instanceof String left && b instanceof String right) {
            return compareStrings(left, right);
        }
        if (a instanceof Number left && b instanceof Number right) {
            return compareNumbers(left, right);
        }
        Integer dateResult = compareDates(a, b);
        if (dateResult != null) {
            return dateResult;
        }
        return compareStrings(ComparableValues.toComparableString(a), ComparableValues.toComparableString(b));
    }

    /**
     * Compares with a direction applied. Nulls still sort last for {@link SortDirection#DESC}.
     */
    public int compare(@Nullable Object a, @Nullable Object b, SortDirection direction) {
        int result = compare(a, b);
        if (a == null || b == null || direction == SortDirection.ASC) {
            return result;
        }
        return -result;
    }

    private int compareStrings(String a, String b) {
        return Integer.signum(collator.compare(a, b));
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (isBig(a) || isBig(b)) {
            BigDecimal left = toBigDecimal(a);
            BigDecimal right = toBigDecimal(b);
            if (left != null && right != null) {
                return Integer.signum(left.compareTo(right));
            }
        }
        return Integer.signum(Double.compare(a.doubleValue(), b.doubleValue()));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static boolean isBig(Number n) {
        return n instanceof BigDecimal || n instanceof BigInteger;
    }

    @Nullable
    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        if (n instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
    }

    @Nullable
    private static Integer compareDates(Object a, Object b) {
        Instant left = toInstant(a);
        Instant right = toInstant(b);
        if (left != null && right != null) {
            return Integer.signum(left.compareTo(right));
        }
        if (a instanceof ChronoLocalDate x && b instanceof ChronoLocalDate y) {
            return Integer.signum(x.compareTo(y));
        }
        if (a instanceof ChronoLocalDateTime<?> x && b instanceof ChronoLocalDateTime<?> y) {
            return Integer.signum(x.compareTo(y));
        }
        return null;
    }

    @Nullable
    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime());
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        return null;
    }
}
