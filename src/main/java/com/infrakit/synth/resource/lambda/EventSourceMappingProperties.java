package com.infrakit.synth.resource.lambda;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;

import lombok.Value;

@Value
public class EventSourceMappingProperties {

    @JsonProperty("FunctionName")
    Reference functionName;

    @JsonProperty("EventSourceArn")
    Reference eventSourceArn;

    @JsonProperty("ScalingConfig")
    ScalingConfig scalingConfig;

    @Value
    public static class ScalingConfig {

        @JsonProperty("MaximumConcurrency")
        int maximumConcurrency;
    }
}
