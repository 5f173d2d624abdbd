package com.infrakit.synth.resource.lambda;

import java.util.List;

import com.infrakit.synth.model.Asset;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Function extends Resource {

    public static final String TYPE = "AWS::Lambda::Function";
    public static final String KIND = "LambdaFunction";

    private final FunctionProperties properties;

    Function(ResourceId resourceId, SynthesizedId synthesizedId, FunctionProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }

    @Override
    public List<Asset> getAssets() {
        return properties.getCode().assets();
    }
}
