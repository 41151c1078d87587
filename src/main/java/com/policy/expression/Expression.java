package com.policy.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of the policy expression language. Sealed: the only variants are the
 * five records below, and every consumer dispatches on {@link #kind()}.
 * <p>
 * Nodes are immutable once built. Literal values are deep-copied into
 * unmodifiable collections.
 */
public sealed interface Expression
        permits Expression.Literal, Expression.FieldAccess, Expression.Operation,
                Expression.Condition, Expression.Permission {

    ExpressionKind kind();

    /**
     * Constant value.
     */
    record Literal(Object value) implements Expression {
        public Literal {
            value = ImmutableValues.copyOf(value);
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.LITERAL;
        }

        @Override
        public String toString() {
            return value instanceof String ? "'" + value + "'" : String.valueOf(value);
        }
    }

    /**
     * Dot-delimited path into the evaluation context (e.g., "author.id", "items.*").
     */
    record FieldAccess(String path) implements Expression {
        public FieldAccess {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("Field path cannot be blank");
            }
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.FIELD;
        }

        @Override
        public String toString() {
            return path;
        }
    }

    /**
     * Named registry operation applied to eagerly evaluated arguments.
     */
    record Operation(String name, List<Expression> args) implements Expression {
        public Operation {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Operation name cannot be blank");
            }
            args = args == null ? List.of() : List.copyOf(args);
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.OPERATION;
        }

        @Override
        public String toString() {
            return name + args;
        }
    }

    /**
     * Binary comparison (eq, ne, gt, lt, gte, lte, in, exists).
     */
    record Condition(String op, Expression left, Expression right) implements Expression {
        public Condition {
            if (op == null || op.isBlank()) {
                throw new IllegalArgumentException("Condition operator cannot be blank");
            }
            Objects.requireNonNull(left, "Condition requires a left operand");
            Objects.requireNonNull(right, "Condition requires a right operand");
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.CONDITION;
        }

        @Override
        public String toString() {
            return left + " " + op + " " + right;
        }
    }

    /**
     * Named permission check with literal string arguments.
     */
    record Permission(String check, List<String> args) implements Expression {
        public Permission {
            if (check == null || check.isBlank()) {
                throw new IllegalArgumentException("Permission check cannot be blank");
            }
            args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.PERMISSION;
        }

        @Override
        public String toString() {
            return check + "(" + String.join(", ", args) + ")";
        }
    }
}
