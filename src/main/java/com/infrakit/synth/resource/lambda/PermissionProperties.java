package com.infrakit.synth.resource.lambda;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;

import lombok.Value;

@Value
public class PermissionProperties {

    @JsonProperty("Action")
    String action;

    @JsonProperty("FunctionName")
    Reference functionName;

    @JsonProperty("Principal")
    String principal;

    @JsonProperty("SourceArn")
    Reference sourceArn;
}
