package com.policy.operation;

import com.policy.context.DefaultFieldResolver;
import com.policy.context.EvaluationContext;
import com.policy.context.FieldResolver;
import com.policy.context.UserInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks against the acting user: hasRole, hasAnyRole, hasAllRoles,
 * hasPermission, isOwner, isAuthenticated, isAnonymous.
 * <p>
 * Role and permission arguments may be given as separate strings or as a
 * single list.
 */
final class PermissionOperations {

    private static final FieldResolver fieldResolver = new DefaultFieldResolver();

    private static final String DEFAULT_OWNER_FIELD = "userId";

    private PermissionOperations() {
    }

    static void register(OperationRegistry.Builder registry) {
        registry.permission("hasRole", (args, ctx) -> {
            String role = Args.fieldName(args, 0);
            return role != null && ctx.getUser().roles().contains(role);
        });
        registry.permission("hasAnyRole", (args, ctx) -> {
            List<String> wanted = names(args);
            return wanted.stream().anyMatch(ctx.getUser().roles()::contains);
        });
        registry.permission("hasAllRoles", (args, ctx) -> {
            List<String> wanted = names(args);
            return !wanted.isEmpty() && ctx.getUser().roles().containsAll(wanted);
        });
        registry.permission("hasPermission", (args, ctx) -> {
            List<String> wanted = names(args);
            return !wanted.isEmpty() && ctx.getUser().permissions().containsAll(wanted);
        });
        registry.permission("isOwner", PermissionOperations::isOwner);
        registry.permission("isAuthenticated", (args, ctx) -> ctx.getUser().isAuthenticated());
        registry.permission("isAnonymous", (args, ctx) -> !ctx.getUser().isAuthenticated());
    }

    /**
     * The record's owner field (default "userId", dotted paths allowed) equals the user id.
     */
    private static boolean isOwner(List<Object> args, EvaluationContext context) {
        UserInfo user = context.getUser();
        if (!user.isAuthenticated()) {
            return false;
        }
        String field = Optional.ofNullable(Args.fieldName(args, 0)).orElse(DEFAULT_OWNER_FIELD);
        return fieldResolver.resolve(field, context.getData())
                .map(owner -> user.id().equals(String.valueOf(owner)))
                .orElse(false);
    }

    private static List<String> names(List<Object> args) {
        List<String> names = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof List<?> list) {
                for (Object item : list) {
                    if (item != null) {
                        names.add(String.valueOf(item));
                    }
                }
            } else if (arg != null) {
                names.add(String.valueOf(arg));
            }
        }
        return names;
    }
}
