package com.policy.rowfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Storage-agnostic row predicate derived from a policy's allow expression.
 * A strict subset of the expression language: field equality leaves and
 * AND/OR combinators, plus the two constants {@link #unrestricted()} and
 * {@link #never()}.
 * <p>
 * Use the {@link #and(List)} and {@link #or(List)} factories rather than the
 * records directly. They keep the tree normalized:
 * <ul>
 *   <li>AND drops unrestricted children and is impossible if any child is</li>
 *   <li>OR is unrestricted if any child is and drops impossible children</li>
 *   <li>a single remaining child replaces its combinator</li>
 * </ul>
 */
public sealed interface RowFilter
        permits RowFilter.Match, RowFilter.And, RowFilter.Or, RowFilter.Unrestricted, RowFilter.Never {

    String AND_KEY = "AND";
    String OR_KEY = "OR";
    String NEVER_FIELD = "id";
    String NEVER_VALUE = "__never__";

    /**
     * Render as the map shape handed to the storage layer:
     * {@code {field: value}}, {@code {AND: [...]}}, {@code {OR: [...]}} or {@code {}}.
     */
    Map<String, Object> toMap();

    default boolean isUnrestricted() {
        return false;
    }

    static RowFilter unrestricted() {
        return Unrestricted.INSTANCE;
    }

    static RowFilter never() {
        return Never.INSTANCE;
    }

    static RowFilter match(String field, Object value) {
        return new Match(field, value);
    }

    /**
     * Parse the map shape produced by {@link #toMap()}, e.g. a caller-supplied
     * where clause. Several plain keys in one map are ANDed.
     *
     * @throws IllegalArgumentException if an AND/OR value is not a list of maps
     */
    static RowFilter fromMap(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return unrestricted();
        }
        List<RowFilter> parts = new ArrayList<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            String key = entry.getKey();
            if (AND_KEY.equals(key)) {
                parts.add(and(fromList(key, entry.getValue())));
            } else if (OR_KEY.equals(key)) {
                parts.add(or(fromList(key, entry.getValue())));
            } else {
                parts.add(match(key, entry.getValue()));
            }
        }
        return and(parts);
    }

    private static List<RowFilter> fromList(String key, Object value) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " expects a list of filters, got: " + value);
        }
        List<RowFilter> filters = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> child)) {
                throw new IllegalArgumentException(key + " expects a list of filters, got item: " + item);
            }
            Map<String, Object> typed = new LinkedHashMap<>();
            child.forEach((k, v) -> typed.put(String.valueOf(k), v));
            filters.add(fromMap(typed));
        }
        return filters;
    }

    static RowFilter and(RowFilter... children) {
        return and(List.of(children));
    }

    static RowFilter and(List<RowFilter> children) {
        List<RowFilter> kept = new ArrayList<>();
        for (RowFilter child : children) {
            if (child instanceof Never) {
                return never();
            }
            if (child instanceof And nested) {
                kept.addAll(nested.children());
            } else if (!child.isUnrestricted()) {
                kept.add(child);
            }
        }
        if (kept.isEmpty()) {
            return unrestricted();
        }
        return kept.size() == 1 ? kept.get(0) : new And(kept);
    }

    static RowFilter or(RowFilter... children) {
        return or(List.of(children));
    }

    static RowFilter or(List<RowFilter> children) {
        if (children.isEmpty()) {
            return unrestricted();
        }
        List<RowFilter> kept = new ArrayList<>();
        for (RowFilter child : children) {
            if (child.isUnrestricted()) {
                return unrestricted();
            }
            if (child instanceof Or nested) {
                kept.addAll(nested.children());
            } else if (!(child instanceof Never)) {
                kept.add(child);
            }
        }
        if (kept.isEmpty()) {
            return never();
        }
        return kept.size() == 1 ? kept.get(0) : new Or(kept);
    }

    /**
     * Equality on one field; the field is a data path such as "author.id".
     */
    record Match(String field, Object value) implements RowFilter {
        public Match {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(field, value);
            return Collections.unmodifiableMap(map);
        }
    }

    record And(List<RowFilter> children) implements RowFilter {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of(AND_KEY, render(children));
        }
    }

    record Or(List<RowFilter> children) implements RowFilter {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of(OR_KEY, render(children));
        }
    }

    /**
     * No constraint: every row is a candidate.
     */
    final class Unrestricted implements RowFilter {
        private static final Unrestricted INSTANCE = new Unrestricted();

        private Unrestricted() {
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of();
        }

        @Override
        public boolean isUnrestricted() {
            return true;
        }

        @Override
        public String toString() {
            return "{}";
        }
    }

    /**
     * Matches no row. Rendered as an equality no real id satisfies.
     */
    final class Never implements RowFilter {
        private static final Never INSTANCE = new Never();

        private Never() {
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of(NEVER_FIELD, NEVER_VALUE);
        }

        @Override
        public String toString() {
            return "never";
        }
    }

    private static List<Map<String, Object>> render(List<RowFilter> children) {
        List<Map<String, Object>> rendered = new ArrayList<>(children.size());
        for (RowFilter child : children) {
            rendered.add(child.toMap());
        }
        return Collections.unmodifiableList(rendered);
    }
}
