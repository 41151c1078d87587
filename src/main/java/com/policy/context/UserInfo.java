package com.policy.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity of the acting user, as supplied by the session provider.
 *
 * @param id          User identifier; null or blank means anonymous
 * @param roles       Role names
 * @param permissions Fine-grained permission names
 * @param attributes  Extra attributes reachable as {@code user.<name>}
 */
public record UserInfo(
        String id,
        List<String> roles,
        List<String> permissions,
        Map<String, Object> attributes
) {
    public UserInfo {
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public UserInfo(String id, List<String> roles) {
        this(id, roles, List.of(), Map.of());
    }

    public UserInfo(String id, List<String> roles, List<String> permissions) {
        this(id, roles, permissions, Map.of());
    }

    public static UserInfo anonymous() {
        return new UserInfo(null, List.of());
    }

    public boolean isAuthenticated() {
        return id != null && !id.isBlank();
    }

    /**
     * View of this user as a map, used to resolve {@code user.*} field paths.
     * Attributes cannot shadow id, roles or permissions.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>(attributes);
        map.put("id", id);
        map.put("roles", roles);
        map.put("permissions", permissions);
        return Collections.unmodifiableMap(map);
    }
}
