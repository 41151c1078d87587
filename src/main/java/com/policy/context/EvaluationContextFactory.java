package com.policy.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Factory for creating EvaluationContext from a JSON record payload.
 * Nested objects stay nested so that dotted field paths can walk them.
 */
public class EvaluationContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EvaluationContextFactory() {
    }

    /**
     * Create an EvaluationContext from a JSON record and the acting user.
     *
     * @param jsonRecord JSON object holding the candidate record - can be null
     * @param user       Acting user - null means anonymous
     * @return EvaluationContext with the parsed record as data
     */
    public static EvaluationContext fromJson(String jsonRecord, UserInfo user) {
        return fromJson(jsonRecord, user, null);
    }

    /**
     * Create an EvaluationContext from a JSON record, the acting user and request parameters.
     *
     * @param jsonRecord JSON object holding the candidate record - can be null
     * @param user       Acting user - null means anonymous
     * @param params     Request parameters - can be null
     * @return EvaluationContext with the parsed record as data
     */
    public static EvaluationContext fromJson(String jsonRecord, UserInfo user, Map<String, ?> params) {
        EvaluationContext.Builder builder = EvaluationContext.builder()
                .user(user)
                .params(params);

        if (jsonRecord != null && !jsonRecord.isBlank()) {
            builder.data(parseJson(jsonRecord));
        }
        return builder.build();
    }

    /**
     * Parse a JSON object into a map of plain values (maps, lists, scalars).
     */
    public static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }
}
