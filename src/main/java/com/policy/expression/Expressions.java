package com.policy.expression;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building expression trees in code.
 */
public final class Expressions {

    private Expressions() {
    }

    public static Expression literal(Object value) {
        return new Expression.Literal(value);
    }

    public static Expression field(String path) {
        return new Expression.FieldAccess(path);
    }

    public static Expression op(String name, Expression... args) {
        return new Expression.Operation(name, Arrays.asList(args));
    }

    public static Expression op(String name, List<Expression> args) {
        return new Expression.Operation(name, args);
    }

    public static Expression condition(String op, Expression left, Expression right) {
        return new Expression.Condition(op, left, right);
    }

    public static Expression eq(Expression left, Expression right) {
        return condition("eq", left, right);
    }

    public static Expression ne(Expression left, Expression right) {
        return condition("ne", left, right);
    }

    public static Expression gt(Expression left, Expression right) {
        return condition("gt", left, right);
    }

    public static Expression gte(Expression left, Expression right) {
        return condition("gte", left, right);
    }

    public static Expression lt(Expression left, Expression right) {
        return condition("lt", left, right);
    }

    public static Expression lte(Expression left, Expression right) {
        return condition("lte", left, right);
    }

    public static Expression in(Expression left, Expression right) {
        return condition("in", left, right);
    }

    public static Expression and(Expression... args) {
        return op("and", args);
    }

    public static Expression or(Expression... args) {
        return op("or", args);
    }

    public static Expression not(Expression arg) {
        return op("not", arg);
    }

    public static Expression permission(String check, String... args) {
        return new Expression.Permission(check, Arrays.asList(args));
    }

    /**
     * Shorthand for the common "field equals user attribute" ownership rule.
     */
    public static Expression ownedBy(String field) {
        return eq(field(field), field("user.id"));
    }
}
