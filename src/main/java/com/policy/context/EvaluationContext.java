package com.policy.context;

import java.util.Map;

/**
 * Everything an expression may read during one evaluation: the candidate
 * record, the acting user, request parameters and engine globals.
 * Read-only: no operation may mutate it.
 */
public interface EvaluationContext {

    /**
     * Candidate record (row) under evaluation.
     */
    Map<String, Object> getData();

    /**
     * Acting user.
     */
    UserInfo getUser();

    /**
     * Request parameters ({@code params.*}).
     */
    Map<String, Object> getParams();

    /**
     * Engine-provided globals ({@code globals.*}), e.g. resource and action.
     */
    Map<String, Object> getGlobals();

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultEvaluationContext.Builder();
    }

    /**
     * Builder for EvaluationContext.
     */
    interface Builder {
        Builder data(Map<String, ?> data);
        Builder dataValue(String name, Object value);
        Builder user(UserInfo user);
        Builder param(String name, Object value);
        Builder params(Map<String, ?> params);
        Builder global(String name, Object value);
        Builder globals(Map<String, ?> globals);
        EvaluationContext build();
    }
}
