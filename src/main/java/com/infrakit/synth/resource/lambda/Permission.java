package com.infrakit.synth.resource.lambda;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

/**
 * Resource-based permission letting a service invoke a function.
 */
@Getter
public class Permission extends Resource {

    public static final String TYPE = "AWS::Lambda::Permission";
    public static final String KIND = "LambdaPermission";

    private final PermissionProperties properties;

    Permission(ResourceId resourceId, SynthesizedId synthesizedId, PermissionProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
