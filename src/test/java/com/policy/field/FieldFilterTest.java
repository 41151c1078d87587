package com.policy.field;

import com.policy.context.EvaluationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldFilterTest {

    private final EvaluationContext context = EvaluationContext.builder().build();

    @Test
    @DisplayName("Deny removes fields from read")
    void denyRemovesFromRead() {
        AllowedFields allowed = FieldFilter.filterFields(
                new FieldSpec(List.of("id", "title", "role"), null, List.of("role")), context);

        assertEquals(List.of("id", "title"), allowed.read());
    }

    @Test
    @DisplayName("Deny wins regardless of its position in the list")
    void denyWinsRegardlessOfOrder() {
        AllowedFields first = FieldFilter.filterFields(
                new FieldSpec(List.of("role", "id", "title"), List.of("role"), List.of("role")), context);
        AllowedFields last = FieldFilter.filterFields(
                new FieldSpec(List.of("id", "title", "role"), List.of("role"), List.of("role")), context);

        assertEquals(List.of("id", "title"), first.read());
        assertEquals(List.of("id", "title"), last.read());
        assertEquals(List.of(), first.write());
    }

    @Test
    @DisplayName("Omitted read and write default to every field")
    void omittedListsDefaultToAll() {
        AllowedFields allowed = FieldFilter.filterFields(new FieldSpec(null, null, null), context);

        assertEquals(List.of("*"), allowed.read());
        assertEquals(List.of("*"), allowed.write());
        assertEquals(allowed, FieldFilter.filterFields(null, context));
    }

    @Test
    @DisplayName("Deny still applies when read is every field")
    void denyAppliesToWildcard() {
        AllowedFields allowed = FieldFilter.filterFields(
                new FieldSpec(List.of("*"), null, List.of("passwordHash")), context);

        assertTrue(allowed.canRead("email"));
        assertFalse(allowed.canRead("passwordHash"));
        assertTrue(allowed.canWrite("email"));
        assertFalse(allowed.canWrite("passwordHash"));
        assertEquals(Map.of("id", 1, "email", "a@b.c"),
                FieldFilter.filterReadable(Map.of("id", 1, "email", "a@b.c", "passwordHash", "x"), allowed));
    }

    @Test
    @DisplayName("filterDataFields keeps only allowed fields")
    void filterDataFieldsStrips() {
        Map<String, Object> result = FieldFilter.filterDataFields(
                Map.of("id", 1, "title", "T", "role", "admin"), List.of("id", "title"));

        assertEquals(Map.of("id", 1, "title", "T"), result);
    }

    @Test
    @DisplayName("filterDataFields never adds fields absent from the source")
    void filterDataFieldsAddsNothing() {
        Map<String, Object> result = FieldFilter.filterDataFields(
                Map.of("id", 1), List.of("id", "title", "secret"));

        assertEquals(Map.of("id", 1), result);
    }

    @Test
    @DisplayName("Wildcard passes the record through")
    void wildcardPassesThrough() {
        Map<String, Object> data = Map.of("id", 1, "title", "T");
        assertEquals(data, FieldFilter.filterDataFields(data, List.of("*")));
    }

    @Test
    @DisplayName("Smuggled fields in a write payload are dropped")
    void smuggledWriteFieldsDropped() {
        AllowedFields allowed = FieldFilter.filterFields(
                new FieldSpec(null, List.of("title", "body"), List.of("role")), context);

        Map<String, Object> payload = Map.of("title", "New", "role", "admin", "ownerId", "me");
        assertEquals(Map.of("title", "New"), FieldFilter.filterWritable(payload, allowed));
    }

    @Test
    @DisplayName("No allowed fields yields an empty record")
    void noneYieldsEmpty() {
        assertEquals(Map.of(), FieldFilter.filterReadable(Map.of("id", 1), AllowedFields.none()));
        assertEquals(Map.of(), FieldFilter.filterDataFields(null, List.of("*")));
    }
}
