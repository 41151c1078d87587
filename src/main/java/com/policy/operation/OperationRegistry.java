package com.policy.operation;

import com.policy.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name-to-function table consulted by the evaluator.
 * <p>
 * The default registry is built once. Custom operations are layered on top
 * by {@link #withCustomOperations(Map)}, which returns a merged copy and
 * never touches the shared defaults.
 */
public final class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    /**
     * Comparators a Condition node may name. Each resolves to the registered operation of the same name.
     */
    public static final Set<String> CONDITION_OPERATORS = Set.of("eq", "ne", "gt", "lt", "gte", "lte", "in", "exists");

    private static final OperationRegistry DEFAULTS = createDefaults();

    private final Map<String, OperationFunction> operations;
    private final Map<String, PermissionCheck> permissionChecks;

    private OperationRegistry(Map<String, OperationFunction> operations,
                              Map<String, PermissionCheck> permissionChecks) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.permissionChecks = Collections.unmodifiableMap(new LinkedHashMap<>(permissionChecks));
    }

    /**
     * Registry holding every built-in operation
     * (math, string, date, logic, comparison, array, permission).
     */
    public static OperationRegistry defaults() {
        return DEFAULTS;
    }

    private static OperationRegistry createDefaults() {
        Builder builder = new Builder();
        MathOperations.register(builder);
        StringOperations.register(builder);
        DateOperations.register(builder);
        LogicOperations.register(builder);
        ComparisonOperations.register(builder);
        ArrayOperations.register(builder);
        PermissionOperations.register(builder);
        OperationRegistry registry = builder.build();
        log.debug("Built default operation registry with {} operations", registry.names().size());
        return registry;
    }

    /**
     * Merged copy of this registry plus the given custom operations.
     *
     * @param custom Custom operations by name
     * @return New registry; this one is unchanged
     * @throws ConfigurationException if a custom name collides with an existing operation
     */
    public OperationRegistry withCustomOperations(Map<String, OperationFunction> custom) {
        Builder builder = toBuilder();
        custom.forEach(builder::operation);
        return builder.build();
    }

    /**
     * Merged copy of this registry plus the given custom permission checks.
     *
     * @throws ConfigurationException if a custom name collides with an existing operation
     */
    public OperationRegistry withCustomPermissionChecks(Map<String, PermissionCheck> custom) {
        Builder builder = toBuilder();
        custom.forEach(builder::permission);
        return builder.build();
    }

    public Optional<OperationFunction> operation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public Optional<PermissionCheck> permissionCheck(String name) {
        return Optional.ofNullable(permissionChecks.get(name));
    }

    public boolean contains(String name) {
        return operations.containsKey(name) || permissionChecks.containsKey(name);
    }

    public boolean isPermissionCheck(String name) {
        return permissionChecks.containsKey(name);
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(operations.keySet());
        names.addAll(permissionChecks.keySet());
        return Collections.unmodifiableSet(names);
    }

    private Builder toBuilder() {
        Builder builder = new Builder();
        builder.operations.putAll(operations);
        builder.permissionChecks.putAll(permissionChecks);
        return builder;
    }

    /**
     * Collects operations; rejects duplicate names across both kinds.
     */
    static final class Builder {
        private final Map<String, OperationFunction> operations = new LinkedHashMap<>();
        private final Map<String, PermissionCheck> permissionChecks = new LinkedHashMap<>();

        Builder operation(String name, OperationFunction function) {
            checkName(name);
            operations.put(name, function);
            return this;
        }

        Builder permission(String name, PermissionCheck check) {
            checkName(name);
            permissionChecks.put(name, check);
            return this;
        }

        private void checkName(String name) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Operation name cannot be blank");
            }
            if (operations.containsKey(name) || permissionChecks.containsKey(name)) {
                log.warn("Rejected operation '{}': name already registered", name);
                throw new ConfigurationException("Operation '" + name + "' is already registered");
            }
        }

        OperationRegistry build() {
            return new OperationRegistry(operations, permissionChecks);
        }
    }
}
