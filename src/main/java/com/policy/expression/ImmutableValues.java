package com.policy.expression;

import com.policy.exception.BudgetExceededException;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural deep copy into unmodifiable collections.
 * Maps become unmodifiable insertion-ordered maps, collections and arrays
 * become unmodifiable lists, scalars are returned as-is.
 * <p>
 * Nesting is capped at {@link #MAX_NESTING} levels; a self-referencing
 * value hits the cap as well.
 */
public final class ImmutableValues {

    public static final int MAX_NESTING = 100;

    private ImmutableValues() {
    }

    /**
     * @throws BudgetExceededException if the value nests deeper than {@link #MAX_NESTING}
     */
    public static Object copyOf(Object value) {
        return copyOf(value, 0);
    }

    /**
     * @throws BudgetExceededException if the map nests deeper than {@link #MAX_NESTING}
     */
    public static Map<String, Object> copyOfMap(Map<?, ?> map) {
        return copyOfMap(map, 0);
    }

    private static Object copyOf(Object value, int depth) {
        if (value instanceof Map<?, ?> map) {
            return copyOfMap(map, depth);
        }
        if (value instanceof Collection<?> collection) {
            checkNesting(depth);
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(copyOf(item, depth + 1));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value != null && value.getClass().isArray()) {
            checkNesting(depth);
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(copyOf(Array.get(value, i), depth + 1));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> copyOfMap(Map<?, ?> map, int depth) {
        if (map == null) {
            return Map.of();
        }
        checkNesting(depth);
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyOf(entry.getValue(), depth + 1));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static void checkNesting(int depth) {
        if (depth >= MAX_NESTING) {
            throw new BudgetExceededException("Value nesting exceeds " + MAX_NESTING + " levels");
        }
    }
}
