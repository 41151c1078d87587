package com.policy.exception;

/**
 * Exception thrown when a policy set or expression tree is malformed.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PolicyException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
