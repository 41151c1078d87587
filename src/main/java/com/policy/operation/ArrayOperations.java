package com.policy.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Arrays: count, sum, avg, first, last, map, filter, find, some, every,
 * slice, unique, flatten. Non-list inputs produce the empty result of the
 * operation (0, [], null or false) rather than an error.
 */
final class ArrayOperations {

    private ArrayOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.operation("count", args -> {
            List<?> list = Args.list(args, 0);
            return list == null ? 0L : (long) list.size();
        });
        registry.operation("sum", args -> ValueConverter.normalize(sum(args)));
        registry.operation("avg", ArrayOperations::avg);
        registry.operation("first", args -> {
            List<?> list = Args.list(args, 0);
            return list == null || list.isEmpty() ? null : list.get(0);
        });
        registry.operation("last", args -> {
            List<?> list = Args.list(args, 0);
            return list == null || list.isEmpty() ? null : list.get(list.size() - 1);
        });
        registry.operation("map", ArrayOperations::map);
        registry.operation("filter", ArrayOperations::filter);
        registry.operation("find", ArrayOperations::find);
        registry.operation("some", args -> {
            List<?> list = Args.list(args, 0);
            return list != null && list.stream().anyMatch(item -> matches(item, args));
        });
        registry.operation("every", args -> {
            List<?> list = Args.list(args, 0);
            return list != null && list.stream().allMatch(item -> matches(item, args));
        });
        registry.operation("slice", ArrayOperations::slice);
        registry.operation("unique", args -> {
            List<?> list = Args.list(args, 0);
            return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(list)));
        });
        registry.operation("flatten", ArrayOperations::flatten);
    }

    /**
     * Item value for an optional field: the field of a map item, or the item itself.
     */
    private static Object pluck(Object item, String field) {
        if (field != null && item instanceof Map<?, ?> map) {
            return map.get(field);
        }
        return item;
    }

    private static boolean matches(Object item, List<Object> args) {
        return ValueConverter.valuesEqual(pluck(item, Args.fieldName(args, 1)), Args.get(args, 2));
    }

    private static double sum(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null) {
            return 0.0;
        }
        String field = Args.fieldName(args, 1);
        double total = 0.0;
        for (Object item : list) {
            total += ValueConverter.toDouble(pluck(item, field)).orElse(0.0);
        }
        return total;
    }

    private static Object avg(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null || list.isEmpty()) {
            return 0L;
        }
        return ValueConverter.normalize(sum(args) / list.size());
    }

    private static Object map(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null) {
            return List.of();
        }
        String field = Args.fieldName(args, 1);
        List<Object> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(pluck(item, field));
        }
        return Collections.unmodifiableList(result);
    }

    private static Object filter(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null) {
            return List.of();
        }
        List<Object> result = new ArrayList<>();
        for (Object item : list) {
            if (matches(item, args)) {
                result.add(item);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static Object find(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null) {
            return null;
        }
        for (Object item : list) {
            if (matches(item, args)) {
                return item;
            }
        }
        return null;
    }

    /**
     * Negative indices count from the end.
     */
    private static Object slice(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null) {
            return List.of();
        }
        int size = list.size();
        int start = Args.get(args, 1) == null ? 0 : index(Args.integer("slice", args, 1), size);
        int end = Args.get(args, 2) == null ? size : index(Args.integer("slice", args, 2), size);
        if (start >= end) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(list.subList(start, end)));
    }

    private static int index(int index, int size) {
        int resolved = index < 0 ? size + index : index;
        return Math.max(0, Math.min(resolved, size));
    }

    private static Object flatten(List<Object> args) {
        List<?> list = Args.list(args, 0);
        if (list == null) {
            return List.of();
        }
        List<Object> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof List<?> nested) {
                result.addAll(nested);
            } else {
                result.add(item);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
