package com.infrakit.synth.resource.s3;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Bucket extends Resource {

    public static final String TYPE = "AWS::S3::Bucket";
    public static final String KIND = "S3Bucket";

    private final BucketProperties properties;

    Bucket(ResourceId resourceId, SynthesizedId synthesizedId, BucketProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
