package com.policy.operation;

import com.policy.exception.EvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MathOperationsTest {

    private final OperationRegistry registry = OperationRegistry.defaults();

    private Object apply(String name, Object... args) {
        return registry.operation(name).orElseThrow().apply(Arrays.asList(args));
    }

    @ParameterizedTest(name = "{0}({1}, {2}) = {3}")
    @CsvSource({
            "add,      5,   3,   8",
            "subtract, 10,  4,   6",
            "multiply, 6,   7,   42",
            "divide,   10,  4,   2.5",
            "mod,      10,  3,   1",
            "pow,      2,   10,  1024",
            "min,      3,   -1,  -1",
            "max,      3,   -1,  3"
    })
    @DisplayName("Binary arithmetic")
    void binaryArithmetic(String op, double a, double b, double expected) {
        Object result = apply(op, a, b);
        assertEquals(expected, ((Number) result).doubleValue(), 1e-9);
    }

    @Test
    @DisplayName("Integral results come back as Long")
    void integralResultsAreLong() {
        assertEquals(8L, apply("add", 5, 3));
        assertEquals(5L, apply("divide", 10, 2));
        assertEquals(2.5, apply("divide", 5, 2));
    }

    @Test
    @DisplayName("add folds over every argument")
    void addFoldsAllArguments() {
        assertEquals(10L, apply("add", 1, 2, 3, 4));
        assertEquals(0.6, ((Number) apply("add", 0.1, 0.2, 0.3)).doubleValue(), 1e-9);
    }

    @Test
    @DisplayName("Division by zero is an error")
    void divisionByZeroFails() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> apply("divide", 10, 0));
        assertEquals("Division by zero", e.getMessage());
        assertThrows(EvaluationException.class, () -> apply("mod", 10, 0));
    }

    @Test
    @DisplayName("Numeric strings are accepted")
    void numericStringsAccepted() {
        assertEquals(15L, apply("add", "10", 5));
    }

    @Test
    @DisplayName("Non-numeric argument is an error")
    void nonNumericFails() {
        assertThrows(EvaluationException.class, () -> apply("add", "abc", 1));
        assertThrows(EvaluationException.class, () -> apply("multiply", null, 2));
    }

    @Test
    @DisplayName("Rounding helpers")
    void roundingHelpers() {
        assertEquals(3L, apply("round", 2.5));
        assertEquals(2L, apply("floor", 2.9));
        assertEquals(3L, apply("ceil", 2.1));
        assertEquals(7L, apply("abs", -7));
        assertEquals(-2L, apply("floor", -1.5));
    }
}
