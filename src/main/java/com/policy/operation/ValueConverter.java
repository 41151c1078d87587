package com.policy.operation;

import java.util.Objects;
import java.util.Optional;

/**
 * Numeric conversion and value comparison rules shared by every operation.
 */
public final class ValueConverter {

    private ValueConverter() {
    }

    public static Optional<Double> toDouble(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Double d) {
            return Optional.of(d);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Collapse a computed double into the narrowest faithful Number:
     * integral values become Long, everything else stays Double.
     */
    public static Number normalize(double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)
                && value == Math.rint(value)
                && Math.abs(value) < 9.007199254740992E15) {
            return (long) value;
        }
        return value;
    }

    /**
     * Equality with numeric widening: 3, 3L and 3.0 are equal.
     */
    public static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        return Objects.equals(a, b);
    }

    /**
     * Ordering between two values of the same family (numbers, strings, booleans).
     *
     * @return Comparison result, or empty when the values are not comparable
     */
    public static Optional<Integer> compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Optional.of(Double.compare(x.doubleValue(), y.doubleValue()));
        }
        if (a instanceof String x && b instanceof String y) {
            return Optional.of(x.compareTo(y));
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Optional.of(x.compareTo(y));
        }
        return Optional.empty();
    }
}
