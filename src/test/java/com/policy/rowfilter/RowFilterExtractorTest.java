package com.policy.rowfilter;

import com.policy.context.EvaluationContext;
import com.policy.context.UserInfo;
import com.policy.expression.Expression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.policy.expression.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for structural row filter extraction.
 */
class RowFilterExtractorTest {

    private RowFilterExtractor extractor;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        extractor = new RowFilterExtractor();
        context = EvaluationContext.builder()
                .user(new UserInfo("user-123", List.of("user")))
                .param("status", "active")
                .build();
    }

    private Map<String, Object> extract(Expression expr) {
        return extractor.extract(expr, context).toMap();
    }

    @Test
    @DisplayName("Equality with a literal becomes a field match")
    void literalEquality() {
        assertEquals(Map.of("published", true), extract(eq(field("published"), literal(true))));
    }

    @Test
    @DisplayName("Literal on the left side works the same")
    void literalOnLeft() {
        assertEquals(Map.of("published", true), extract(eq(literal(true), field("published"))));
    }

    @Test
    @DisplayName("Equality with a user field is resolved against the user")
    void userFieldEquality() {
        assertEquals(Map.of("uploadedBy", "user-123"), extract(eq(field("uploadedBy"), field("user.id"))));
        assertEquals(Map.of("uploadedBy", "user-123"), extract(eq(field("user.id"), field("uploadedBy"))));
    }

    @Test
    @DisplayName("Equality with a params field is resolved against the params")
    void paramsFieldEquality() {
        assertEquals(Map.of("status", "active"), extract(eq(field("status"), field("params.status"))));
    }

    @Test
    @DisplayName("OR combines its children")
    void orCombinesChildren() {
        Expression expr = or(
                eq(field("isPublic"), literal(true)),
                eq(field("uploadedBy"), field("user.id")));

        assertEquals(
                Map.of("OR", List.of(Map.of("isPublic", true), Map.of("uploadedBy", "user-123"))),
                extract(expr));
    }

    @Test
    @DisplayName("Mixed AND/OR keeps its nesting")
    void mixedNesting() {
        Expression expr = and(
                eq(field("tenantId"), literal("t1")),
                or(eq(field("isPublic"), literal(true)), eq(field("uploadedBy"), field("user.id"))));

        assertEquals(
                Map.of("AND", List.of(
                        Map.of("tenantId", "t1"),
                        Map.of("OR", List.of(Map.of("isPublic", true), Map.of("uploadedBy", "user-123"))))),
                extract(expr));
    }

    @Test
    @DisplayName("Permission checks contribute no constraint")
    void permissionIsUnrestricted() {
        assertEquals(Map.of(), extract(permission("hasRole", "admin")));
        assertEquals(Map.of(), extract(op("isOwner", literal("userId"))));
    }

    @Test
    @DisplayName("AND drops unreducible children")
    void andDropsUnreducible() {
        Expression expr = and(permission("isAuthenticated"), eq(field("published"), literal(true)));
        assertEquals(Map.of("published", true), extract(expr));
    }

    @Test
    @DisplayName("OR with an unreducible child widens to no constraint")
    void orWithUnreducibleWidens() {
        Expression expr = or(permission("hasRole", "admin"), eq(field("uploadedBy"), field("user.id")));
        assertEquals(Map.of(), extract(expr));
    }

    @Test
    @DisplayName("Comparisons other than equality contribute no constraint")
    void nonEqualityIsUnrestricted() {
        assertEquals(Map.of(), extract(gt(field("price"), literal(10))));
        assertEquals(Map.of(), extract(ne(field("status"), literal("deleted"))));
        assertEquals(Map.of(), extract(not(eq(field("status"), literal("deleted")))));
    }

    @Test
    @DisplayName("Field-to-field and wildcard equalities contribute no constraint")
    void unreducibleEqualities() {
        assertEquals(Map.of(), extract(eq(field("a"), field("b"))));
        assertEquals(Map.of(), extract(eq(field("tags.*"), literal("x"))));
        assertEquals(Map.of(), extract(eq(literal(1), literal(1))));
    }

    @Test
    @DisplayName("Literal true is unrestricted, literal false matches nothing")
    void literalConstants() {
        assertTrue(extractor.extract(literal(true), context).isUnrestricted());
        assertEquals(Map.of("id", "__never__"), extract(literal(false)));
        assertEquals(Map.of("a", 1), extract(or(literal(false), eq(field("a"), literal(1)))));
    }

    @Test
    @DisplayName("Extraction is idempotent")
    void extractionIsIdempotent() {
        Expression expr = or(eq(field("isPublic"), literal(true)), eq(field("uploadedBy"), field("user.id")));
        RowFilter first = extractor.extract(expr, context);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, extractor.extract(expr, context));
        }
    }

    @Test
    @DisplayName("Trees deeper than the extraction limit widen")
    void deepTreesWiden() {
        RowFilterExtractor shallow = new RowFilterExtractor(2);
        Expression expr = eq(field("a"), literal(1));
        for (int i = 0; i < 5; i++) {
            expr = and(expr, eq(field("b" + i), literal(i)));
        }

        assertTrue(shallow.extract(expr, context).toMap().containsKey("AND"));
        assertFalse(shallow.extract(expr, context).toMap().toString().contains("a=1"));
    }
}
