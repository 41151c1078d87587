package com.policy.context;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves dot-delimited field paths against an evaluation context.
 * <p>
 * Absence is data, not an error: a missing or null intermediate yields an
 * empty result.
 */
public interface FieldResolver {

    /**
     * Wildcard segment: returns the current array unconsumed.
     */
    String WILDCARD = "*";

    /**
     * Resolve a path against the scope it names.
     *
     * @param path    Field path (e.g., "author.id", "user.roles", "items.*")
     * @param context Evaluation context
     * @return Resolved value, or empty if absent
     */
    Optional<Object> resolve(String path, EvaluationContext context);

    /**
     * Resolve a path against an explicit root map, ignoring scope prefixes.
     *
     * @param path Field path relative to the root
     * @param root Root map
     * @return Resolved value, or empty if absent
     */
    Optional<Object> resolve(String path, Map<String, ?> root);
}
