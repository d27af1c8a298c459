package com.dcruver.compass.store;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lenient coercions from loosely-typed raw record values.
 * None of these throw: a value that cannot be coerced becomes null (or the stated default).
 */
final class RawValues {

    private RawValues() {}

    static String text(Object value) {
        return value == null ? null : value.toString();
    }

    static String trimToNull(Object value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s.trim());
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /**
     * Integer value of a number or numeric string; fractional numbers truncate toward zero.
     */
    static Integer integer(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        try {
            if (value instanceof Number n) {
                return new BigDecimal(n.toString()).intValueExact();
            }
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            if (value instanceof Number n && Double.isFinite(n.doubleValue())
                && Math.abs(n.doubleValue()) <= Integer.MAX_VALUE) {
                return (int) n.doubleValue();
            }
            return null;
        }
    }

    /**
     * Integer value of a number or numeric string, truncated toward zero and clamped to
     * {@code min..max}, so magnitudes beyond int range still land on a bound.
     */
    static Integer clampedInteger(Object value, int min, int max) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        BigDecimal number;
        try {
            number = new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
        if (number.compareTo(BigDecimal.valueOf(min)) < 0) {
            return min;
        }
        if (number.compareTo(BigDecimal.valueOf(max)) > 0) {
            return max;
        }
        return number.setScale(0, RoundingMode.DOWN).intValueExact();
    }

    static Integer nonNegativeInteger(Object value) {
        Integer parsed = integer(value);
        return parsed != null && parsed >= 0 ? parsed : null;
    }

    /**
     * Ordered, de-duplicated list of non-blank strings. A single string is split on commas.
     */
    static List<String> stringList(Object value) {
        Set<String> items = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                String trimmed = trimToNull(item);
                if (trimmed != null) {
                    items.add(trimmed);
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    items.add(trimmed);
                }
            }
        }
        return new ArrayList<>(items);
    }

    /**
     * Parse an ISO-8601 timestamp. Values without an offset are taken as UTC.
     */
    static Instant instant(Object value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
