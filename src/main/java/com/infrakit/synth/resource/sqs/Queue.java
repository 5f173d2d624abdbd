package com.infrakit.synth.resource.sqs;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Queue extends Resource {

    public static final String TYPE = "AWS::SQS::Queue";
    public static final String KIND = "SqsQueue";

    private final QueueProperties properties;

    Queue(ResourceId resourceId, SynthesizedId synthesizedId, QueueProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }

    public boolean isFifo() {
        return Boolean.TRUE.equals(properties.getFifoQueue());
    }
}
