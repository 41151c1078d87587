package com.policy.context;

import com.policy.exception.EvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DefaultFieldResolverTest {

    private final FieldResolver resolver = new DefaultFieldResolver();

    private final EvaluationContext context = EvaluationContext.builder()
            .data(Map.of("post", Map.of("author", Map.of("id", "u1")), "tags", List.of("x", "y")))
            .user(new UserInfo("u1", List.of("admin"), List.of(), Map.of("tenant", "t1")))
            .param("page", 2)
            .global("action", "read")
            .build();

    @Test
    @DisplayName("Data paths resolve through nested maps and lists")
    void dataPaths() {
        assertEquals(Optional.of("u1"), resolver.resolve("post.author.id", context));
        assertEquals(Optional.of("y"), resolver.resolve("tags.1", context));
        assertEquals(Optional.empty(), resolver.resolve("post.editor.id", context));
    }

    @Test
    @DisplayName("Scope prefixes select user, params and globals")
    void scopedPaths() {
        assertEquals(Optional.of("u1"), resolver.resolve("user.id", context));
        assertEquals(Optional.of("t1"), resolver.resolve("user.tenant", context));
        assertEquals(Optional.of(2), resolver.resolve("params.page", context));
        assertEquals(Optional.of("read"), resolver.resolve("globals.action", context));
    }

    @Test
    @DisplayName("User attributes cannot shadow the user id")
    void attributesCannotShadowId() {
        UserInfo user = new UserInfo("real", List.of(), List.of(), Map.of("id", "fake"));
        EvaluationContext ctx = EvaluationContext.builder().user(user).build();
        assertEquals(Optional.of("real"), resolver.resolve("user.id", ctx));
    }

    @Test
    @DisplayName("A bare scope name is an ordinary data field")
    void bareScopeNameIsData() {
        EvaluationContext ctx = EvaluationContext.builder().dataValue("user", "plain").build();
        assertEquals(Optional.of("plain"), resolver.resolve("user", ctx));
        assertEquals(FieldScope.DATA, FieldScope.fromPath("user"));
        assertEquals(FieldScope.USER, FieldScope.fromPath("user.id"));
        assertEquals("id", FieldScope.relativePath("user.id"));
    }

    @Test
    @DisplayName("Wildcard returns the list, and fails on a non-list")
    void wildcard() {
        assertEquals(Optional.of(List.of("x", "y")), resolver.resolve("tags.*", context));
        assertThrows(EvaluationException.class, () -> resolver.resolve("post.*", context));
    }
}
