package com.infrakit.synth.resource.sqs;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class QueuePolicy extends Resource {

    public static final String TYPE = "AWS::SQS::QueuePolicy";
    public static final String KIND = "QueuePolicy";

    private final QueuePolicyProperties properties;

    QueuePolicy(ResourceId resourceId, SynthesizedId synthesizedId, QueuePolicyProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
