package com.infrakit.synth.model;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builders for the template's intrinsic function objects.
 */
public final class IntrinsicFunctions {

    public static final String REF = "Ref";
    public static final String GET_ATT = "Fn::GetAtt";
    public static final String JOIN = "Fn::Join";

    public static final String AWS_ACCOUNT_ID = "AWS::AccountId";
    public static final String AWS_PARTITION = "AWS::Partition";
    public static final String AWS_REGION = "AWS::Region";

    private static final String PSEUDO_PARAMETER_PREFIX = "AWS::";
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private IntrinsicFunctions() {
        // Utility class
    }

    public static ObjectNode ref(String id) {
        ObjectNode node = NODES.objectNode();
        node.put(REF, id);
        return node;
    }

    public static ObjectNode getAtt(String id, String attribute) {
        ObjectNode node = NODES.objectNode();
        node.putArray(GET_ATT).add(id).add(attribute);
        return node;
    }

    /**
     * {@code Fn::Join} over literal strings and nested intrinsic nodes.
     */
    public static ObjectNode join(String delimiter, List<?> elements) {
        ObjectNode node = NODES.objectNode();
        ArrayNode args = node.putArray(JOIN);
        args.add(delimiter);
        ArrayNode parts = args.addArray();
        for (Object element : elements) {
            if (element instanceof JsonNode json) {
                parts.add(json);
            } else if (element instanceof Reference reference) {
                parts.add(reference.toJson());
            } else {
                parts.add(String.valueOf(element));
            }
        }
        return node;
    }

    public static ObjectNode pseudoParameter(String name) {
        if (!isPseudoParameter(name)) {
            throw new IllegalArgumentException("not a pseudo parameter: " + name);
        }
        return ref(name);
    }

    public static boolean isPseudoParameter(String id) {
        return id != null && id.startsWith(PSEUDO_PARAMETER_PREFIX);
    }
}
