package com.policy.operation;

import com.policy.context.EvaluationContext;
import com.policy.context.UserInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PermissionOperationsTest {

    private final OperationRegistry registry = OperationRegistry.defaults();

    private final UserInfo editor = new UserInfo("user-123", List.of("editor", "viewer"), List.of("post:edit"));

    private boolean check(String name, EvaluationContext context, Object... args) {
        return registry.permissionCheck(name).orElseThrow().check(Arrays.asList(args), context);
    }

    private EvaluationContext contextFor(UserInfo user, Map<String, Object> data) {
        return EvaluationContext.builder().user(user).data(data).build();
    }

    @Test
    @DisplayName("hasRole checks a single role")
    void hasRole() {
        EvaluationContext ctx = contextFor(editor, Map.of());
        assertTrue(check("hasRole", ctx, "editor"));
        assertFalse(check("hasRole", ctx, "admin"));
        assertFalse(check("hasRole", ctx));
    }

    @Test
    @DisplayName("hasAnyRole and hasAllRoles accept varargs or a list")
    void anyAndAllRoles() {
        EvaluationContext ctx = contextFor(editor, Map.of());
        assertTrue(check("hasAnyRole", ctx, "admin", "viewer"));
        assertTrue(check("hasAnyRole", ctx, List.of("admin", "editor")));
        assertFalse(check("hasAnyRole", ctx, "admin"));
        assertTrue(check("hasAllRoles", ctx, "editor", "viewer"));
        assertFalse(check("hasAllRoles", ctx, List.of("editor", "admin")));
        assertFalse(check("hasAllRoles", ctx));
    }

    @Test
    @DisplayName("hasPermission checks fine-grained permissions")
    void hasPermission() {
        EvaluationContext ctx = contextFor(editor, Map.of());
        assertTrue(check("hasPermission", ctx, "post:edit"));
        assertFalse(check("hasPermission", ctx, "post:delete"));
    }

    @Test
    @DisplayName("isOwner compares the owner field with the user id")
    void isOwner() {
        assertTrue(check("isOwner", contextFor(editor, Map.of("userId", "user-123"))));
        assertFalse(check("isOwner", contextFor(editor, Map.of("userId", "someone-else"))));
        assertTrue(check("isOwner", contextFor(editor, Map.of("createdBy", "user-123")), "createdBy"));
    }

    @Test
    @DisplayName("isOwner follows nested paths")
    void isOwnerNestedPath() {
        EvaluationContext ctx = contextFor(editor, Map.of("author", Map.of("id", "user-123")));
        assertTrue(check("isOwner", ctx, "author.id"));
    }

    @Test
    @DisplayName("isOwner is false for an anonymous user even when the owner field is empty")
    void isOwnerAnonymous() {
        Map<String, Object> data = new HashMap<>();
        data.put("userId", null);
        assertFalse(check("isOwner", contextFor(UserInfo.anonymous(), data)));
        assertFalse(check("isOwner", contextFor(new UserInfo("", List.of()), Map.of("userId", ""))));
    }

    @Test
    @DisplayName("isAuthenticated and isAnonymous")
    void authenticationChecks() {
        assertTrue(check("isAuthenticated", contextFor(editor, Map.of())));
        assertFalse(check("isAnonymous", contextFor(editor, Map.of())));
        assertTrue(check("isAnonymous", contextFor(new UserInfo("", List.of()), Map.of())));
        assertTrue(check("isAnonymous", contextFor(UserInfo.anonymous(), Map.of())));
    }
}
