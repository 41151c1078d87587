package com.policy.operation;

import com.policy.exception.EvaluationException;

import java.util.List;

/**
 * Argument access helpers shared by the operation families.
 */
final class Args {

    private Args() {
    }

    /**
     * Argument at index, or null when not supplied.
     */
    static Object get(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    static double number(String op, List<Object> args, int index) {
        Object value = get(args, index);
        return ValueConverter.toDouble(value)
                .orElseThrow(() -> new EvaluationException(
                        op + " expects a numeric argument at position " + index + ", got: " + value));
    }

    static int integer(String op, List<Object> args, int index) {
        return (int) number(op, args, index);
    }

    static String string(List<Object> args, int index) {
        Object value = get(args, index);
        return value == null ? "" : String.valueOf(value);
    }

    static String fieldName(List<Object> args, int index) {
        Object value = get(args, index);
        return value == null ? null : String.valueOf(value);
    }

    static List<?> list(List<Object> args, int index) {
        Object value = get(args, index);
        return value instanceof List<?> list ? list : null;
    }

    static void requireAtLeast(String op, List<Object> args, int count) {
        if (args.size() < count) {
            throw new EvaluationException(op + " expects at least " + count + " argument(s), got " + args.size());
        }
    }
}
