package com.policy.operation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Comparators: eq, ne, gt, lt, gte, lte, in.
 * These same functions back Condition nodes (see {@link OperationRegistry#CONDITION_OPERATORS}),
 * so each comparison has one implementation.
 */
final class ComparisonOperations {

    private ComparisonOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.operation("eq", args -> ValueConverter.valuesEqual(Args.get(args, 0), Args.get(args, 1)));
        registry.operation("ne", args -> !ValueConverter.valuesEqual(Args.get(args, 0), Args.get(args, 1)));
        registry.operation("gt", args -> compare(args).map(c -> c > 0).orElse(false));
        registry.operation("lt", args -> compare(args).map(c -> c < 0).orElse(false));
        registry.operation("gte", args -> compare(args).map(c -> c >= 0).orElse(false));
        registry.operation("lte", args -> compare(args).map(c -> c <= 0).orElse(false));
        registry.operation("in", ComparisonOperations::in);
    }

    /**
     * Mixed or null operands are not ordered, so every ordering comparator is false for them.
     */
    private static Optional<Integer> compare(List<Object> args) {
        return ValueConverter.compare(Args.get(args, 0), Args.get(args, 1));
    }

    private static Object in(List<Object> args) {
        Object value = Args.get(args, 0);
        Object container = Args.get(args, 1);
        if (container instanceof List<?> list) {
            return list.stream().anyMatch(item -> ValueConverter.valuesEqual(item, value));
        }
        if (container instanceof Map<?, ?> map) {
            return value != null && map.containsKey(String.valueOf(value));
        }
        if (container instanceof String s) {
            return value != null && s.contains(String.valueOf(value));
        }
        return false;
    }
}
