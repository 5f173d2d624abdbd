package com.infrakit.synth.resource.sqs;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;
import com.infrakit.synth.resource.iam.PolicyDocument;

import lombok.Value;

@Value
public class QueuePolicyProperties {

    @JsonProperty("Queues")
    List<Reference> queues;

    @JsonProperty("PolicyDocument")
    PolicyDocument policyDocument;
}
