package com.shiprule.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating MatchRecords from orders, items or raw JSON test data.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 */
public final class MatchRecordFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MatchRecordFactory() {
    }

    /**
     * Merge an order and one of its items. Item fields win on key collision.
     */
    public static MatchRecord merge(Order order, LineItem item) {
        MatchRecord.Builder builder = MatchRecord.builder();
        if (order != null) {
            builder.fields(order.toFields());
        }
        if (item != null) {
            builder.fields(item.toFields());
        }
        return builder.build();
    }

    /**
     * Create a record from an arbitrary field map (e.g. dry-run test data).
     */
    public static MatchRecord fromMap(Map<String, ?> data) {
        return MatchRecord.builder().fields(data).build();
    }

    /**
     * Create a record from a JSON object.
     *
     * @param jsonPayload JSON object text
     * @return Record with flattened fields
     */
    public static MatchRecord fromJson(String jsonPayload) {
        return fromMap(parseJson(jsonPayload));
    }

    /**
     * Parse a JSON object into a flat map.
     */
    public static Map<String, Object> parseJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(jsonPayload, new TypeReference<Map<String, Object>>() {});
            return flatten(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (value instanceof List) {
                // Lists are kept as-is
                result.put(key, value);
            } else if (value != null) {
                result.put(key, value);
            }
        }
    }
}
