package com.policy.field;

import com.policy.context.EvaluationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level permissions: resolves a rule's field lists and strips
 * disallowed fields from records going out and payloads coming in.
 */
public final class FieldFilter {

    private FieldFilter() {
    }

    /**
     * Resolve the effective read/write lists of a field spec. Deny always wins.
     *
     * @param spec    Declared field lists; null means unrestricted
     * @param context Evaluation context (reserved for context-dependent lists)
     * @return Allowed fields
     */
    public static AllowedFields filterFields(FieldSpec spec, EvaluationContext context) {
        FieldSpec effective = spec != null ? spec : FieldSpec.unrestricted();
        return new AllowedFields(
                subtract(effective.read(), effective.deny()),
                subtract(effective.write(), effective.deny()),
                effective.deny());
    }

    /**
     * Copy of {@code data} holding only the keys present in both the record and
     * {@code allowedFields}. {@code ["*"]} keeps every key.
     */
    public static Map<String, Object> filterDataFields(Map<String, ?> data, List<String> allowedFields) {
        return filterDataFields(data, allowedFields, List.of());
    }

    /**
     * As {@link #filterDataFields(Map, List)}, additionally dropping every denied key.
     */
    public static Map<String, Object> filterDataFields(Map<String, ?> data, List<String> allowedFields,
                                                       List<String> deniedFields) {
        if (data == null) {
            return Map.of();
        }
        boolean all = allowedFields != null && allowedFields.contains(FieldSpec.ALL);
        Map<String, Object> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            if (deniedFields != null && deniedFields.contains(key)) {
                continue;
            }
            if (all || (allowedFields != null && allowedFields.contains(key))) {
                filtered.put(key, entry.getValue());
            }
        }
        return Collections.unmodifiableMap(filtered);
    }

    /**
     * Record as the caller may read it.
     */
    public static Map<String, Object> filterReadable(Map<String, ?> data, AllowedFields allowed) {
        return filterDataFields(data, allowed.read(), allowed.deny());
    }

    /**
     * Write payload reduced to the fields the caller may write.
     */
    public static Map<String, Object> filterWritable(Map<String, ?> data, AllowedFields allowed) {
        return filterDataFields(data, allowed.write(), allowed.deny());
    }

    private static List<String> subtract(List<String> fields, List<String> deny) {
        List<String> result = new ArrayList<>(fields.size());
        for (String field : fields) {
            if (!deny.contains(field) && !result.contains(field)) {
                result.add(field);
            }
        }
        return result;
    }
}
