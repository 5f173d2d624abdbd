package com.infrakit.synth.resource.sns;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class TopicPolicy extends Resource {

    public static final String TYPE = "AWS::SNS::TopicPolicy";
    public static final String KIND = "TopicPolicy";

    private final TopicPolicyProperties properties;

    TopicPolicy(ResourceId resourceId, SynthesizedId synthesizedId, TopicPolicyProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
