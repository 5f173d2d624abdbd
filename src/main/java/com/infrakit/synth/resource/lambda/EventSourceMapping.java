package com.infrakit.synth.resource.lambda;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

/**
 * Feeds messages of a queue to a function.
 */
@Getter
public class EventSourceMapping extends Resource {

    public static final String TYPE = "AWS::Lambda::EventSourceMapping";
    public static final String KIND = "EventSourceMapping";

    private final EventSourceMappingProperties properties;

    EventSourceMapping(ResourceId resourceId, SynthesizedId synthesizedId, EventSourceMappingProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
