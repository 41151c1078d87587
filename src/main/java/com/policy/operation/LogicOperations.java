package com.policy.operation;

import com.policy.expression.Truthiness;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Boolean logic and null handling: and, or, not, if, coalesce, exists, isNull, isEmpty.
 * Arguments arrive already evaluated, so and/or do not short-circuit.
 */
final class LogicOperations {

    private LogicOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.operation("and", args -> args.stream().allMatch(Truthiness::isTruthy));
        registry.operation("or", args -> args.stream().anyMatch(Truthiness::isTruthy));
        registry.operation("not", args -> !Truthiness.isTruthy(Args.get(args, 0)));
        registry.operation("if", args -> Truthiness.isTruthy(Args.get(args, 0)) ? Args.get(args, 1) : Args.get(args, 2));
        registry.operation("coalesce", LogicOperations::coalesce);
        registry.operation("exists", args -> Args.get(args, 0) != null);
        registry.operation("isNull", args -> Args.get(args, 0) == null);
        registry.operation("isEmpty", args -> isEmpty(Args.get(args, 0)));
    }

    private static Object coalesce(List<Object> args) {
        for (Object arg : args) {
            if (arg != null) {
                return arg;
            }
        }
        return null;
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }
}
