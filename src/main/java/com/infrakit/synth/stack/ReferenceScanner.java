package com.infrakit.synth.stack;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.infrakit.synth.model.IntrinsicFunctions;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.serialization.TemplateJson;

/**
 * Finds the resource ids a property tree points at through {@code Ref} and
 * {@code Fn::GetAtt}, and rewrites them when ids are renamed.
 * Pseudo parameters ({@code AWS::Region} and friends) are not resource ids and are skipped.
 */
public final class ReferenceScanner {

    private ReferenceScanner() {
        // Utility class
    }

    /**
     * Ids referenced by the resource's payload, in document order, without duplicates.
     */
    public static Set<SynthesizedId> referencedIds(Resource resource) {
        Set<SynthesizedId> ids = new LinkedHashSet<>();
        collect(TemplateJson.toTree(resource.getProperties()), ids);
        return ids;
    }

    public static Set<SynthesizedId> referencedIds(JsonNode tree) {
        Set<SynthesizedId> ids = new LinkedHashSet<>();
        collect(tree, ids);
        return ids;
    }

    /**
     * Returns a copy of {@code tree} with every referenced id found in {@code renames}
     * replaced by its new value.
     */
    public static JsonNode rewrite(JsonNode tree, Map<SynthesizedId, SynthesizedId> renames) {
        JsonNode copy = tree.deepCopy();
        if (!renames.isEmpty()) {
            rewriteInPlace(copy, renames);
        }
        return copy;
    }

    private static void collect(JsonNode node, Set<SynthesizedId> ids) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            String target = targetOf(node);
            if (target != null) {
                if (!IntrinsicFunctions.isPseudoParameter(target)) {
                    ids.add(SynthesizedId.of(target));
                }
                return;
            }
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                collect(child, ids);
            }
        }
    }

    private static void rewriteInPlace(JsonNode node, Map<SynthesizedId, SynthesizedId> renames) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            JsonNode ref = object.get(IntrinsicFunctions.REF);
            if (object.size() == 1 && ref != null && ref.isTextual()) {
                SynthesizedId renamed = lookup(renames, ref.asText());
                if (renamed != null) {
                    object.set(IntrinsicFunctions.REF, TextNode.valueOf(renamed.getValue()));
                }
                return;
            }
            JsonNode getAtt = object.get(IntrinsicFunctions.GET_ATT);
            if (object.size() == 1 && getAtt != null) {
                rewriteGetAtt(object, getAtt, renames);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                rewriteInPlace(fields.next().getValue(), renames);
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                rewriteInPlace(child, renames);
            }
        }
    }

    private static void rewriteGetAtt(ObjectNode object, JsonNode getAtt, Map<SynthesizedId, SynthesizedId> renames) {
        if (getAtt.isArray() && getAtt.size() > 0 && getAtt.get(0).isTextual()) {
            SynthesizedId renamed = lookup(renames, getAtt.get(0).asText());
            if (renamed != null) {
                ((ArrayNode) getAtt).set(0, TextNode.valueOf(renamed.getValue()));
            }
        } else if (getAtt.isTextual()) {
            String text = getAtt.asText();
            int dot = text.indexOf('.');
            String id = dot < 0 ? text : text.substring(0, dot);
            SynthesizedId renamed = lookup(renames, id);
            if (renamed != null) {
                String rest = dot < 0 ? "" : text.substring(dot);
                object.set(IntrinsicFunctions.GET_ATT, TextNode.valueOf(renamed.getValue() + rest));
            }
        }
    }

    private static SynthesizedId lookup(Map<SynthesizedId, SynthesizedId> renames, String id) {
        return id.isBlank() ? null : renames.get(SynthesizedId.of(id));
    }

    // Short form "Id.Attribute" is accepted for GetAtt as well as the array form.
    private static String targetOf(JsonNode object) {
        if (object.size() != 1) {
            return null;
        }
        JsonNode ref = object.get(IntrinsicFunctions.REF);
        if (ref != null) {
            return ref.isTextual() && !ref.asText().isBlank() ? ref.asText() : null;
        }
        JsonNode getAtt = object.get(IntrinsicFunctions.GET_ATT);
        if (getAtt == null) {
            return null;
        }
        if (getAtt.isArray() && getAtt.size() > 0 && getAtt.get(0).isTextual() && !getAtt.get(0).asText().isBlank()) {
            return getAtt.get(0).asText();
        }
        if (getAtt.isTextual() && !getAtt.asText().isBlank()) {
            String text = getAtt.asText();
            int dot = text.indexOf('.');
            return dot < 0 ? text : text.substring(0, dot);
        }
        return null;
    }
}
