package com.infrakit.synth.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A resource of any kind, carried as a type name and a raw property tree. Used for
 * templates read back from JSON and for kinds that have no typed builder.
 */
public class GenericResource extends Resource {

    private final JsonNode properties;

    public GenericResource(ResourceId resourceId, SynthesizedId synthesizedId, String type, JsonNode properties) {
        super(resourceId, synthesizedId, type);
        this.properties = properties != null ? properties.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Creates a resource with a freshly generated id, e.g.
     * {@code create(ResourceId.of("alarm"), "CloudWatchAlarm", "AWS::CloudWatch::Alarm", props)}.
     */
    public static GenericResource create(ResourceId resourceId, String kind, String type, JsonNode properties) {
        return new GenericResource(resourceId, IdGenerator.shared().generate(kind), type, properties);
    }

    /**
     * A copy of the property tree; changing it leaves this resource untouched.
     */
    @Override
    public JsonNode getProperties() {
        return properties.deepCopy();
    }
}
