package com.policy.expression;

import java.util.Collection;

/**
 * Boolean coercion used by the access check and the logic operations.
 * <p>
 * Falsey: {@code false}, {@code null}, numeric zero (and NaN), the empty
 * string, the empty list. Everything else is truthy, including empty maps.
 */
public final class Truthiness {

    private Truthiness() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }
}
