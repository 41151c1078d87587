package com.policy.operation;

import com.policy.exception.EvaluationException;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Arithmetic: add, subtract, multiply, divide, mod, pow, abs, round, floor, ceil, min, max.
 * Results are normalized so that integral values come back as Long.
 */
final class MathOperations {

    private MathOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.operation("add", args -> fold("add", args, Double::sum));
        registry.operation("subtract", args -> fold("subtract", args, (a, b) -> a - b));
        registry.operation("multiply", args -> fold("multiply", args, (a, b) -> a * b));
        registry.operation("divide", MathOperations::divide);
        registry.operation("mod", MathOperations::mod);
        registry.operation("pow", args -> ValueConverter.normalize(
                Math.pow(Args.number("pow", args, 0), Args.number("pow", args, 1))));
        registry.operation("abs", args -> ValueConverter.normalize(Math.abs(Args.number("abs", args, 0))));
        registry.operation("round", args -> ValueConverter.normalize(Math.round(Args.number("round", args, 0))));
        registry.operation("floor", args -> ValueConverter.normalize(Math.floor(Args.number("floor", args, 0))));
        registry.operation("ceil", args -> ValueConverter.normalize(Math.ceil(Args.number("ceil", args, 0))));
        registry.operation("min", args -> fold("min", args, Math::min));
        registry.operation("max", args -> fold("max", args, Math::max));
    }

    private static Object fold(String op, List<Object> args, DoubleBinaryOperator combiner) {
        Args.requireAtLeast(op, args, 1);
        double result = Args.number(op, args, 0);
        for (int i = 1; i < args.size(); i++) {
            result = combiner.applyAsDouble(result, Args.number(op, args, i));
        }
        return ValueConverter.normalize(result);
    }

    private static Object divide(List<Object> args) {
        double dividend = Args.number("divide", args, 0);
        double divisor = Args.number("divide", args, 1);
        if (divisor == 0.0) {
            throw new EvaluationException("Division by zero");
        }
        return ValueConverter.normalize(dividend / divisor);
    }

    private static Object mod(List<Object> args) {
        double dividend = Args.number("mod", args, 0);
        double divisor = Args.number("mod", args, 1);
        if (divisor == 0.0) {
            throw new EvaluationException("Division by zero");
        }
        return ValueConverter.normalize(dividend % divisor);
    }
}
