package com.policy.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policy.exception.ConfigurationException;
import com.policy.expression.Expression;
import com.policy.field.FieldSpec;
import com.policy.policy.Action;
import com.policy.policy.PolicyRule;
import com.policy.policy.PolicySet;
import com.policy.sandbox.EvaluationBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Loads policy documents from YAML or JSON.
 * <p>
 * Document shape:
 * <pre>
 * name: blog-policies
 * version: "1.0"
 * budget:
 *   max-depth: 10
 *   max-operations: 100
 *   timeout-ms: 100
 *   allowed-operations: [eq, and, or, hasRole]
 * policies:
 *   - resource: Post          # or "model"
 *     action: read
 *     allow: { type: condition, op: eq, left: {...}, right: {...} }
 *     fields: { read: [id, title], write: [title], deny: [secret] }
 * </pre>
 * The top level may also be nested under a {@code policy} key.
 */
public class PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private PolicyLoader() {
    }

    /**
     * Load a policy document from a path.
     * Supports classpath: prefix for classpath resources; {@code .json}
     * files are read as JSON, everything else as YAML.
     *
     * @param path Path to the policy document
     * @return Loaded configuration
     */
    public static PolicyConfig load(String path) {
        log.info("Loading policies from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            return path.toLowerCase().endsWith(".json") ? fromJson(content) : fromYaml(content);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load policies from: " + path, e);
        }
    }

    /**
     * Parse a YAML policy document.
     */
    public static PolicyConfig fromYaml(String yamlContent) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML policy document: " + e.getMessage(), e);
        }
        return parse(root);
    }

    /**
     * Parse a JSON policy document.
     */
    public static PolicyConfig fromJson(String jsonContent) {
        Map<String, Object> root;
        try {
            root = objectMapper.readValue(jsonContent, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON policy document: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static PolicyConfig parse(Object document) {
        if (document == null) {
            throw new ConfigurationException("Policy document is empty");
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ConfigurationException("Policy document must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) document;

        // Policies could be at root or under 'policy' key
        Map<String, Object> policyRoot = root.get("policy") instanceof Map<?, ?> nested
                ? (Map<String, Object>) nested
                : root;

        String name = getString(policyRoot, "name", "default");
        String version = getString(policyRoot, "version", "1.0");
        EvaluationBudget budget = parseBudget(policyRoot.get("budget"));
        List<PolicyRule> rules = parseRules(policyRoot.get("policies"));

        if (rules.isEmpty()) {
            log.warn("Policy document '{}' declares no policies; every request will be denied", name);
        }

        PolicyConfig config = new PolicyConfig(name, version, PolicySet.of(rules), budget);
        log.info("Loaded policies: {} v{} with {} rules, budget depth={} ops={} timeout={}ms",
                name, version, rules.size(), budget.maxDepth(), budget.maxOperations(), budget.timeoutMs());
        return config;
    }

    private static List<PolicyRule> parseRules(Object policies) {
        if (policies == null) {
            return List.of();
        }
        if (!(policies instanceof List<?> list)) {
            throw new ConfigurationException("'policies' must be a list");
        }

        List<PolicyRule> rules = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> ruleMap)) {
                throw new ConfigurationException("policies[" + i + "] must be a mapping");
            }
            PolicyRule rule = parseRule(ruleMap, "policies[" + i + "]");
            rules.add(rule);
            log.debug("Parsed policy {} -> {}", i, rule);
        }
        return rules;
    }

    private static PolicyRule parseRule(Map<?, ?> ruleMap, String location) {
        Object resource = ruleMap.containsKey("resource") ? ruleMap.get("resource") : ruleMap.get("model");
        if (resource == null || resource.toString().isBlank()) {
            throw new ConfigurationException(location + ": 'resource' is required");
        }
        Object action = ruleMap.get("action");
        if (action == null) {
            throw new ConfigurationException(location + ": 'action' is required");
        }
        Object allow = ruleMap.get("allow");
        if (allow == null) {
            throw new ConfigurationException(location + ": 'allow' is required");
        }

        Action parsedAction;
        try {
            parsedAction = Action.fromString(action.toString());
        } catch (ConfigurationException e) {
            throw new ConfigurationException(location + ": " + e.getMessage(), e);
        }
        Expression allowExpr = ExpressionNodeParser.parse(allow, location + ".allow");
        FieldSpec fields = parseFields(ruleMap.get("fields"), location + ".fields");

        return new PolicyRule(resource.toString(), parsedAction, allowExpr, fields);
    }

    private static FieldSpec parseFields(Object fields, String location) {
        if (fields == null) {
            return FieldSpec.unrestricted();
        }
        if (!(fields instanceof Map<?, ?> map)) {
            throw new ConfigurationException(location + " must be a mapping");
        }
        return new FieldSpec(
                getStringList(map, "read", location),
                getStringList(map, "write", location),
                getStringList(map, "deny", location));
    }

    private static EvaluationBudget parseBudget(Object budget) {
        EvaluationBudget defaults = EvaluationBudget.defaults();
        if (budget == null) {
            return defaults;
        }
        if (!(budget instanceof Map<?, ?> map)) {
            throw new ConfigurationException("'budget' must be a mapping");
        }

        List<String> allowed = getStringList(map, "allowed-operations", "budget");
        try {
            return new EvaluationBudget(
                    getInt(map, "max-depth", defaults.maxDepth()),
                    getInt(map, "max-operations", defaults.maxOperations()),
                    getInt(map, "timeout-ms", (int) defaults.timeoutMs()),
                    allowed != null ? new LinkedHashSet<>(allowed) : null);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid budget: " + e.getMessage(), e);
        }
    }

    private static List<String> getStringList(Map<?, ?> map, String key, String location) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(location + "." + key + " must be a list");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<?, ?> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }
}
