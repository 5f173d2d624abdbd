package com.infrakit.synth.resource.iam;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.PropertyValues;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One policy statement. Resources may be literal ARNs, references or intrinsic nodes.
 */
@Value
public class Statement {

    @JsonProperty("Sid")
    String sid;

    @NonNull
    @JsonProperty("Effect")
    Effect effect;

    @JsonProperty("Principal")
    Principal principal;

    @JsonProperty("Action")
    List<String> actions;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("Resource")
    List<Object> resources;

    @JsonProperty("Condition")
    JsonNode condition;

    @Builder
    private Statement(String sid, @NonNull Effect effect, Principal principal, @Singular List<String> actions,
            @Singular List<Object> resources, JsonNode condition) {
        this.sid = sid;
        this.effect = effect;
        this.principal = principal;
        this.actions = actions;
        this.resources = PropertyValues.copyAll(resources);
        this.condition = PropertyValues.copy(condition);
    }

    public List<Object> getResources() {
        return PropertyValues.copyAll(resources);
    }

    public JsonNode getCondition() {
        return PropertyValues.copy(condition);
    }

    public static Statement allow(Principal principal, String... actions) {
        return Statement.builder()
                .effect(Effect.ALLOW)
                .principal(principal)
                .actions(List.of(actions))
                .build();
    }
}
