package com.policy.policy;

import com.policy.exception.ConfigurationException;

/**
 * Action a policy rule governs.
 */
public enum Action {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse an action name, case-insensitively.
     *
     * @throws ConfigurationException if the name is not a known action
     */
    public static Action fromString(String value) {
        if (value != null) {
            for (Action action : values()) {
                if (action.value.equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new ConfigurationException("Unknown action: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
