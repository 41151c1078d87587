package com.policy.context;

import com.policy.exception.EvaluationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of FieldResolver.
 * Walks nested maps by key and lists by numeric index.
 */
public class DefaultFieldResolver implements FieldResolver {

    @Override
    public Optional<Object> resolve(String path, EvaluationContext context) {
        if (path == null || path.isEmpty() || context == null) {
            return Optional.empty();
        }
        FieldScope scope = FieldScope.fromPath(path);
        return resolve(FieldScope.relativePath(path), scope.root(context));
    }

    @Override
    public Optional<Object> resolve(String path, Map<String, ?> root) {
        if (path == null || path.isEmpty() || root == null) {
            return Optional.empty();
        }

        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current == null) {
                return Optional.empty();
            }
            if (WILDCARD.equals(segment)) {
                if (!(current instanceof List<?>)) {
                    throw new EvaluationException("Cannot use wildcard '*' on non-array value in path '" + path + "'");
                }
                return Optional.of(current);
            }
            current = step(current, segment);
        }
        return Optional.ofNullable(current);
    }

    private Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
