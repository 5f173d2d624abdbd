package com.infrakit.synth.resource.iam;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Role extends Resource {

    public static final String TYPE = "AWS::IAM::Role";
    public static final String KIND = "Role";

    private final RoleProperties properties;

    Role(ResourceId resourceId, SynthesizedId synthesizedId, RoleProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
