package com.infrakit.synth.resource.sns;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;

import lombok.Value;

@Value
public class SubscriptionProperties {

    public static final String LAMBDA_PROTOCOL = "lambda";

    @JsonProperty("Protocol")
    String protocol;

    @JsonProperty("Endpoint")
    Reference endpoint;

    @JsonProperty("TopicArn")
    Reference topicArn;
}
