package com.infrakit.synth.resource.cloudwatch;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class LogGroup extends Resource {

    public static final String TYPE = "AWS::Logs::LogGroup";
    public static final String KIND = "LogGroup";

    private final LogGroupProperties properties;

    LogGroup(ResourceId resourceId, SynthesizedId synthesizedId, LogGroupProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
