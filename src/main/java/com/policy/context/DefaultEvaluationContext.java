package com.policy.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default implementation of EvaluationContext.
 * Immutable after construction at the top level; the sandbox deep-copies
 * nested values before evaluation.
 */
public final class DefaultEvaluationContext implements EvaluationContext {

    private final Map<String, Object> data;
    private final UserInfo user;
    private final Map<String, Object> params;
    private final Map<String, Object> globals;

    public DefaultEvaluationContext(Map<String, Object> data, UserInfo user,
                                    Map<String, Object> params, Map<String, Object> globals) {
        this.data = unmodifiableCopy(data);
        this.user = user != null ? user : UserInfo.anonymous();
        this.params = unmodifiableCopy(params);
        this.globals = unmodifiableCopy(globals);
    }

    private DefaultEvaluationContext(Builder builder) {
        this(builder.data, builder.user, builder.params, builder.globals);
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public UserInfo getUser() {
        return user;
    }

    @Override
    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public Map<String, Object> getGlobals() {
        return globals;
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "user=" + user.id() +
                ", data=" + data.keySet() +
                ", params=" + params.keySet() +
                ", globals=" + globals +
                '}';
    }

    /**
     * Builder for DefaultEvaluationContext.
     */
    public static class Builder implements EvaluationContext.Builder {
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final Map<String, Object> globals = new LinkedHashMap<>();
        private UserInfo user = UserInfo.anonymous();

        @Override
        public Builder data(Map<String, ?> data) {
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        @Override
        public Builder dataValue(String name, Object value) {
            if (name != null) {
                this.data.put(name, value);
            }
            return this;
        }

        @Override
        public Builder user(UserInfo user) {
            this.user = user;
            return this;
        }

        @Override
        public Builder param(String name, Object value) {
            if (name != null) {
                this.params.put(name, value);
            }
            return this;
        }

        @Override
        public Builder params(Map<String, ?> params) {
            if (params != null) {
                this.params.putAll(params);
            }
            return this;
        }

        @Override
        public Builder global(String name, Object value) {
            if (name != null) {
                this.globals.put(name, value);
            }
            return this;
        }

        @Override
        public Builder globals(Map<String, ?> globals) {
            if (globals != null) {
                this.globals.putAll(globals);
            }
            return this;
        }

        @Override
        public EvaluationContext build() {
            return new DefaultEvaluationContext(this);
        }
    }
}
