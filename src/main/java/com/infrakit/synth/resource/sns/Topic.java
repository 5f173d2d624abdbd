package com.infrakit.synth.resource.sns;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Topic extends Resource {

    public static final String TYPE = "AWS::SNS::Topic";
    public static final String KIND = "SnsTopic";

    private final TopicProperties properties;

    Topic(ResourceId resourceId, SynthesizedId synthesizedId, TopicProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }

    public boolean isFifo() {
        return Boolean.TRUE.equals(properties.getFifoTopic());
    }
}
