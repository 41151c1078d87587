package com.policy.context;

import java.util.Map;

/**
 * Part of the evaluation context a field path reads from.
 * A path resolves against the record data unless its first segment names
 * one of the other scopes ({@code user.id}, {@code params.limit}).
 */
public enum FieldScope {
    /**
     * Candidate record fields (default).
     */
    DATA(null),

    /**
     * Acting user ({@code user.*}).
     */
    USER("user"),

    /**
     * Request parameters ({@code params.*}).
     */
    PARAMS("params"),

    /**
     * Engine globals ({@code globals.*}).
     */
    GLOBALS("globals");

    private final String prefix;

    FieldScope(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Determine the scope a path reads from.
     *
     * @param path Field path (e.g., "user.id")
     * @return The scope, DATA when no scope prefix is present
     */
    public static FieldScope fromPath(String path) {
        for (FieldScope scope : values()) {
            if (scope.prefix != null && path.startsWith(scope.prefix + ".")) {
                return scope;
            }
        }
        return DATA;
    }

    /**
     * Path relative to the scope root.
     *
     * @param path Field path (e.g., "user.id")
     * @return The remaining path (e.g., "id")
     */
    public static String relativePath(String path) {
        FieldScope scope = fromPath(path);
        return scope.prefix == null ? path : path.substring(scope.prefix.length() + 1);
    }

    /**
     * Root map of this scope within the context.
     */
    public Map<String, Object> root(EvaluationContext context) {
        return switch (this) {
            case DATA -> context.getData();
            case USER -> context.getUser().asMap();
            case PARAMS -> context.getParams();
            case GLOBALS -> context.getGlobals();
        };
    }
}
