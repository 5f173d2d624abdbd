package com.infrakit.synth.resource.dynamodb;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.Getter;

@Getter
public class Table extends Resource {

    public static final String TYPE = "AWS::DynamoDB::Table";
    public static final String KIND = "DynamoDBTable";

    private final TableProperties properties;

    Table(ResourceId resourceId, SynthesizedId synthesizedId, TableProperties properties) {
        super(resourceId, synthesizedId, TYPE);
        this.properties = properties;
    }
}
