package com.infrakit.synth.resource.s3;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class BucketPolicy extends Resource {

    public static final String TYPE = "AWS::S3::BucketPolicy";
    public static final String KIND = "BucketPolicy";

    private final BucketPolicyProperties properties;

    BucketPolicy(ResourceId resourceId, SynthesizedId synthesizedId, BucketPolicyProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
