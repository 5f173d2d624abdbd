package com.infrakit.synth.resource.iam;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.PropertyValues;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class RoleProperties {

    @JsonProperty("RoleName")
    String roleName;

    @JsonProperty("AssumeRolePolicyDocument")
    PolicyDocument assumeRolePolicyDocument;

    /**
     * Literal ARNs or {@code Fn::Join} nodes.
     */
    @Singular
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("ManagedPolicyArns")
    List<Object> managedPolicyArns;

    @Singular
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("Policies")
    List<Policy> policies;

    public List<Object> getManagedPolicyArns() {
        return PropertyValues.copyAll(managedPolicyArns);
    }
}
