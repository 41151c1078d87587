package com.policy.operation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArrayOperationsTest {

    private final OperationRegistry registry = OperationRegistry.defaults();

    private final List<Map<String, Object>> orders = List.of(
            Map.of("id", 1, "status", "paid", "total", 10),
            Map.of("id", 2, "status", "open", "total", 25),
            Map.of("id", 3, "status", "paid", "total", 5));

    private Object apply(String name, Object... args) {
        return registry.operation(name).orElseThrow().apply(Arrays.asList(args));
    }

    @Test
    @DisplayName("count, first and last")
    void countFirstLast() {
        assertEquals(3L, apply("count", orders));
        assertEquals(orders.get(0), apply("first", orders));
        assertEquals(orders.get(2), apply("last", orders));
        assertEquals(0L, apply("count", "not a list"));
        assertNull(apply("first", List.of()));
    }

    @Test
    @DisplayName("sum and avg over plain numbers and over a field")
    void sumAndAvg() {
        assertEquals(6L, apply("sum", List.of(1, 2, 3)));
        assertEquals(40L, apply("sum", orders, "total"));
        assertEquals(2L, apply("avg", List.of(1, 2, 3)));
        assertEquals(2.5, apply("avg", List.of(2, 3)));
        assertEquals(0L, apply("avg", List.of()));
    }

    @Test
    @DisplayName("map plucks a field from each item")
    void mapPlucksField() {
        assertEquals(List.of(1, 2, 3), apply("map", orders, "id"));
    }

    @Test
    @DisplayName("filter and find match a field value")
    void filterAndFind() {
        List<?> paid = (List<?>) apply("filter", orders, "status", "paid");
        assertEquals(2, paid.size());
        assertEquals(orders.get(1), apply("find", orders, "status", "open"));
        assertNull(apply("find", orders, "status", "void"));
    }

    @Test
    @DisplayName("some and every")
    void someAndEvery() {
        assertEquals(true, apply("some", orders, "status", "open"));
        assertEquals(false, apply("every", orders, "status", "paid"));
        assertEquals(true, apply("every", List.of(1, 1), null, 1));
        assertEquals(false, apply("some", null, "status", "open"));
    }

    @Test
    @DisplayName("slice supports negative indices")
    void sliceNegativeIndices() {
        List<Integer> numbers = List.of(1, 2, 3, 4, 5);
        assertEquals(List.of(2, 3), apply("slice", numbers, 1, 3));
        assertEquals(List.of(4, 5), apply("slice", numbers, -2));
        assertEquals(List.of(), apply("slice", numbers, 4, 2));
    }

    @Test
    @DisplayName("unique keeps first occurrences, flatten goes one level deep")
    void uniqueAndFlatten() {
        assertEquals(List.of("a", "b"), apply("unique", List.of("a", "b", "a")));
        assertEquals(Arrays.asList("a", null), apply("unique", Arrays.asList("a", null, null)));
        assertEquals(List.of(1, 2, 3, List.of(4)),
                apply("flatten", List.of(List.of(1, 2), 3, List.of(List.of(4)))));
    }
}
