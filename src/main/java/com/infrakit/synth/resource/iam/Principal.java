package com.infrakit.synth.resource.iam;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infrakit.synth.model.ConfigurationException;

import lombok.NonNull;
import lombok.Value;

/**
 * Who a policy statement applies to. The wire form depends on the kind:
 * {@code {"Service": "lambda.amazonaws.com"}}, {@code {"AWS": "arn:..."}} or a literal
 * string such as {@code "*"}.
 */
@Value
public class Principal {

    public enum Kind {
        SERVICE("Service"),
        AWS("AWS"),
        LITERAL(null);

        private final String key;

        Kind(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    @NonNull
    Kind kind;

    @NonNull
    String value;

    public static Principal service(String service) {
        return new Principal(Kind.SERVICE, service);
    }

    public static Principal aws(String accountOrArn) {
        return new Principal(Kind.AWS, accountOrArn);
    }

    public static Principal literal(String literal) {
        return new Principal(Kind.LITERAL, literal);
    }

    public static Principal everyone() {
        return literal("*");
    }

    @JsonValue
    public JsonNode toJson() {
        if (kind == Kind.LITERAL) {
            return JsonNodeFactory.instance.textNode(value);
        }
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(kind.getKey(), value);
        return node;
    }

    /**
     * Reads a principal back from its wire form. The kind is decided by the shape of the
     * node: a string is a literal, an object must hold exactly one {@code Service} or
     * {@code AWS} entry.
     */
    public static Principal fromJson(JsonNode node) {
        if (node == null) {
            throw new ConfigurationException("principal is missing");
        }
        if (node.isTextual()) {
            return literal(node.asText());
        }
        if (node.isObject() && node.size() == 1) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isTextual()) {
                for (Kind candidate : Kind.values()) {
                    if (entry.getKey().equals(candidate.getKey())) {
                        return new Principal(candidate, entry.getValue().asText());
                    }
                }
            }
        }
        throw new ConfigurationException("unsupported principal: " + node);
    }

    @Override
    public String toString() {
        return kind == Kind.LITERAL ? value : kind.getKey() + ":" + value;
    }
}
