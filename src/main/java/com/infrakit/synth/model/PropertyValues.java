package com.infrakit.synth.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Copies free-form property values so a built payload never shares a mutable
 * {@link JsonNode} or collection with its caller.
 */
public final class PropertyValues {

    private PropertyValues() {
        // Utility class
    }

    public static Object copy(Object value) {
        return value instanceof JsonNode node ? node.deepCopy() : value;
    }

    public static JsonNode copy(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    public static List<Object> copyAll(List<?> values) {
        if (values == null) {
            return null;
        }
        List<Object> copy = new ArrayList<>(values.size());
        for (Object value : values) {
            copy.add(copy(value));
        }
        return Collections.unmodifiableList(copy);
    }

    public static Map<String, Object> copyAll(Map<String, ?> values) {
        if (values == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, copy(value)));
        return Collections.unmodifiableMap(copy);
    }
}
