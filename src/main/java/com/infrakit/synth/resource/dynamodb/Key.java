package com.infrakit.synth.resource.dynamodb;

import lombok.NonNull;
import lombok.Value;

/**
 * A partition or sort key: attribute name plus scalar type.
 */
@Value
public class Key {

    @NonNull
    String name;

    @NonNull
    AttributeType type;

    public static Key of(String name, AttributeType type) {
        return new Key(name, type);
    }
}
