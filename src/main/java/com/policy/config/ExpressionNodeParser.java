package com.policy.config;

import com.policy.exception.ConfigurationException;
import com.policy.expression.Expression;
import com.policy.expression.ExpressionKind;
import com.policy.expression.Expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts the generic map form of an expression node (as read from YAML or
 * JSON) into an {@link Expression} tree.
 * <p>
 * Node shapes:
 * <pre>
 * { type: literal,    value: ... }
 * { type: field,      path: "author.id" }
 * { type: operation,  op: "add", args: [ node, ... ] }
 * { type: condition,  op: "eq", left: node, right: node }
 * { type: permission, check: "hasRole", args: [ "admin" ] }
 * </pre>
 * A list in place of a node is an implicit AND of its elements.
 */
final class ExpressionNodeParser {

    private ExpressionNodeParser() {
    }

    /**
     * Parse a node.
     *
     * @param node     Map, or list for an implicit AND
     * @param location Position in the document, used in error messages
     * @throws ConfigurationException on any malformed node
     */
    static Expression parse(Object node, String location) {
        if (node instanceof List<?> list) {
            return Expressions.op("and", parseList(list, location));
        }
        if (!(node instanceof Map<?, ?> map)) {
            throw new ConfigurationException(location + ": expected an expression node, got: " + node);
        }

        ExpressionKind kind = kindOf(map, location);
        try {
            return switch (kind) {
                case LITERAL -> {
                    if (!map.containsKey("value")) {
                        throw new ConfigurationException(location + ": literal requires 'value'");
                    }
                    yield Expressions.literal(map.get("value"));
                }
                case FIELD -> Expressions.field(requireString(map, "path", location));
                case OPERATION -> {
                    String name = map.containsKey("op")
                            ? requireString(map, "op", location)
                            : requireString(map, "name", location);
                    yield Expressions.op(name, parseList(optionalList(map, "args", location), location + "." + name));
                }
                case CONDITION -> Expressions.condition(
                        requireString(map, "op", location),
                        parse(require(map, "left", location), location + ".left"),
                        parse(require(map, "right", location), location + ".right"));
                case PERMISSION -> {
                    String check = requireString(map, "check", location);
                    List<String> args = new ArrayList<>();
                    for (Object arg : optionalList(map, "args", location)) {
                        args.add(String.valueOf(arg));
                    }
                    yield new Expression.Permission(check, args);
                }
            };
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException(location + ": " + e.getMessage(), e);
        }
    }

    private static List<Expression> parseList(List<?> nodes, String location) {
        List<Expression> expressions = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            expressions.add(parse(nodes.get(i), location + "[" + i + "]"));
        }
        return expressions;
    }

    private static ExpressionKind kindOf(Map<?, ?> map, String location) {
        Object type = map.get("type");
        if (type == null) {
            throw new ConfigurationException(location + ": expression node requires 'type'");
        }
        try {
            return ExpressionKind.fromTag(type.toString());
        } catch (ConfigurationException e) {
            throw new ConfigurationException(location + ": " + e.getMessage(), e);
        }
    }

    private static Object require(Map<?, ?> map, String key, String location) {
        Object value = map.get(key);
        if (value == null) {
            throw new ConfigurationException(location + ": '" + key + "' is required");
        }
        return value;
    }

    private static String requireString(Map<?, ?> map, String key, String location) {
        Object value = require(map, key, location);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new ConfigurationException(location + ": '" + key + "' must be a non-empty string");
        }
        return s;
    }

    private static List<?> optionalList(Map<?, ?> map, String key, String location) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(location + ": '" + key + "' must be a list");
        }
        return list;
    }
}
