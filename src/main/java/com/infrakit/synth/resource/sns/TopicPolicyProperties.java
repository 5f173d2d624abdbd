package com.infrakit.synth.resource.sns;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;
import com.infrakit.synth.resource.iam.PolicyDocument;

import lombok.Value;

@Value
public class TopicPolicyProperties {

    @JsonProperty("Topics")
    List<Reference> topics;

    @JsonProperty("PolicyDocument")
    PolicyDocument policyDocument;
}
