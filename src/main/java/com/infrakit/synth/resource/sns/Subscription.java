package com.infrakit.synth.resource.sns;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Subscription extends Resource {

    public static final String TYPE = "AWS::SNS::Subscription";
    public static final String KIND = "SnsSubscription";

    private final SubscriptionProperties properties;

    Subscription(ResourceId resourceId, SynthesizedId synthesizedId, SubscriptionProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
