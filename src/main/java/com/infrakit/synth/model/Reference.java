package com.infrakit.synth.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Opaque pointer from one resource's properties to another resource.
 * Only handed out by {@link Resource#ref()}, {@link Resource#arn()} and
 * {@link Resource#attribute(String)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class Reference {

    @NonNull
    SynthesizedId target;

    /**
     * Attribute read from the target, {@code null} for a plain {@code Ref}.
     */
    String attribute;

    public boolean isAttribute() {
        return attribute != null;
    }

    @JsonValue
    public JsonNode toJson() {
        return attribute == null
                ? IntrinsicFunctions.ref(target.getValue())
                : IntrinsicFunctions.getAtt(target.getValue(), attribute);
    }

    @Override
    public String toString() {
        return attribute == null ? "Ref(" + target + ")" : "GetAtt(" + target + "." + attribute + ")";
    }
}
