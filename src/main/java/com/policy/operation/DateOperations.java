package com.policy.operation;

import com.policy.exception.EvaluationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Dates: now, today, parseDate, addDays, diffDays, isBefore, isAfter,
 * formatDate, year, month, day.
 * <p>
 * Inputs may be ISO-8601 strings (date or date-time), epoch millis, or
 * java.time values. All arithmetic happens in UTC. A null input yields null.
 */
final class DateOperations {

    private DateOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.operation("now", args -> Instant.now().toString());
        registry.operation("today", args -> LocalDate.now(ZoneOffset.UTC).toString());
        registry.operation("parseDate", args -> nullSafe(args, v -> toInstant(v).toString()));
        registry.operation("addDays", DateOperations::addDays);
        registry.operation("diffDays", DateOperations::diffDays);
        registry.operation("isBefore", args -> compareDates(args) < 0);
        registry.operation("isAfter", args -> compareDates(args) > 0);
        registry.operation("formatDate", DateOperations::formatDate);
        registry.operation("year", args -> nullSafe(args, v -> (long) utc(v).getYear()));
        registry.operation("month", args -> nullSafe(args, v -> (long) utc(v).getMonthValue()));
        registry.operation("day", args -> nullSafe(args, v -> (long) utc(v).getDayOfMonth()));
    }

    private interface DateFunction {
        Object apply(Object value);
    }

    private static Object nullSafe(List<Object> args, DateFunction function) {
        Object value = Args.get(args, 0);
        return value == null ? null : function.apply(value);
    }

    /**
     * Keeps the input's shape: a plain date stays a plain date.
     */
    private static Object addDays(List<Object> args) {
        Object value = Args.get(args, 0);
        if (value == null) {
            return null;
        }
        long days = (long) Args.number("addDays", args, 1);
        try {
            if (value instanceof LocalDate date) {
                return date.plusDays(days).toString();
            }
            if (value instanceof String s && isPlainDate(s)) {
                return LocalDate.parse(s).plusDays(days).toString();
            }
            return toInstant(value).plus(days, ChronoUnit.DAYS).toString();
        } catch (DateTimeException | ArithmeticException e) {
            throw new EvaluationException("Cannot add " + days + " days to '" + value + "'", e);
        }
    }

    /**
     * Whole days from the second argument to the first ({@code a - b}).
     */
    private static Object diffDays(List<Object> args) {
        Object a = Args.get(args, 0);
        Object b = Args.get(args, 1);
        if (a == null || b == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(toInstant(b), toInstant(a));
    }

    private static int compareDates(List<Object> args) {
        Object a = Args.get(args, 0);
        Object b = Args.get(args, 1);
        if (a == null || b == null) {
            throw new EvaluationException("Date comparison requires two dates");
        }
        return toInstant(a).compareTo(toInstant(b));
    }

    private static Object formatDate(List<Object> args) {
        Object value = Args.get(args, 0);
        if (value == null) {
            return null;
        }
        String pattern = Args.get(args, 1) == null ? "yyyy-MM-dd" : Args.string(args, 1);
        try {
            return DateTimeFormatter.ofPattern(pattern).format(utc(value));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new EvaluationException("Invalid date pattern '" + pattern + "'", e);
        }
    }

    private static ZonedDateTime utc(Object value) {
        return toInstant(value).atZone(ZoneOffset.UTC);
    }

    private static boolean isPlainDate(String s) {
        return s.length() == 10 && s.charAt(4) == '-' && s.charAt(7) == '-';
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof TemporalAccessor temporal) {
            try {
                return Instant.from(temporal);
            } catch (DateTimeException e) {
                throw new EvaluationException("Unsupported date value: " + value, e);
            }
        }
        if (value instanceof String s) {
            return parse(s.trim());
        }
        throw new EvaluationException("Unsupported date value: " + value);
    }

    private static Instant parse(String s) {
        try {
            if (isPlainDate(s)) {
                return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (s.endsWith("Z")) {
                return Instant.parse(s);
            }
            if (s.indexOf('+', 10) > 0 || s.lastIndexOf('-') > 9) {
                return OffsetDateTime.parse(s).toInstant();
            }
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new EvaluationException("Invalid date: " + s, e);
        }
    }
}
