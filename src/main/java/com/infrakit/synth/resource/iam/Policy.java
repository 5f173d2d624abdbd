package com.infrakit.synth.resource.iam;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.NonNull;
import lombok.Value;

/**
 * Inline policy attached to a role.
 */
@Value
public class Policy {

    @NonNull
    @JsonProperty("PolicyName")
    String policyName;

    @NonNull
    @JsonProperty("PolicyDocument")
    PolicyDocument policyDocument;
}
