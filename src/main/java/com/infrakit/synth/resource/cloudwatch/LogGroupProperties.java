package com.infrakit.synth.resource.cloudwatch;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LogGroupProperties {

    @JsonProperty("LogGroupName")
    String logGroupName;

    @JsonProperty("LogGroupClass")
    LogGroupClass logGroupClass;

    @JsonProperty("RetentionInDays")
    Integer retentionInDays;
}
