package com.infrakit.synth.resource.sns;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FifoThroughputScope {
    TOPIC("Topic"),
    MESSAGE_GROUP("MessageGroup");

    private final String value;

    FifoThroughputScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
