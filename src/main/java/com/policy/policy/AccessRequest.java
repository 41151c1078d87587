package com.policy.policy;

import com.policy.context.UserInfo;

import java.util.Map;
import java.util.Objects;

/**
 * A question put to the engine: may {@code user} perform {@code action} on
 * {@code resource}, optionally for one concrete record.
 *
 * @param resource Resource (model) name
 * @param action   Requested action
 * @param user     Acting user; anonymous when null
 * @param data     Record under consideration (may be empty)
 * @param params   Request parameters
 */
public record AccessRequest(
        String resource,
        Action action,
        UserInfo user,
        Map<String, Object> data,
        Map<String, Object> params
) {
    public AccessRequest {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
        user = user != null ? user : UserInfo.anonymous();
        data = data != null ? data : Map.of();
        params = params != null ? params : Map.of();
    }

    public AccessRequest(String resource, Action action, UserInfo user) {
        this(resource, action, user, Map.of(), Map.of());
    }

    public AccessRequest(String resource, Action action, UserInfo user, Map<String, Object> data) {
        this(resource, action, user, data, Map.of());
    }
}
