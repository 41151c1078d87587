package com.policy.expression;

import com.policy.exception.ConfigurationException;

/**
 * Closed set of expression node kinds.
 */
public enum ExpressionKind {
    LITERAL("literal"),
    FIELD("field"),
    OPERATION("operation"),
    CONDITION("condition"),
    PERMISSION("permission");

    private final String tag;

    ExpressionKind(String tag) {
        this.tag = tag;
    }

    /**
     * Resolve a kind from its document tag.
     *
     * @param tag Node tag (e.g., "condition")
     * @return The matching kind
     * @throws ConfigurationException if the tag is unknown
     */
    public static ExpressionKind fromTag(String tag) {
        if (tag != null) {
            for (ExpressionKind kind : values()) {
                if (kind.tag.equalsIgnoreCase(tag)) {
                    return kind;
                }
            }
        }
        throw new ConfigurationException("Unknown expression type: " + tag);
    }
}
