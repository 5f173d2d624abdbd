package com.infrakit.synth.serialization;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * The one Jackson configuration used for template bodies: payload fields are read
 * directly (names come from {@code @JsonProperty}), absent values are omitted.
 */
public final class TemplateJson {

    private static final ObjectMapper MAPPER = createMapper();

    private TemplateJson() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Renders a resource property payload to a tree.
     */
    public static JsonNode toTree(Object properties) {
        if (properties instanceof JsonNode node) {
            return node;
        }
        return MAPPER.valueToTree(properties);
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setVisibility(PropertyAccessor.ALL, Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }
}
