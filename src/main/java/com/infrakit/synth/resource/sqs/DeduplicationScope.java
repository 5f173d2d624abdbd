package com.infrakit.synth.resource.sqs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeduplicationScope {
    QUEUE("queue"),
    MESSAGE_GROUP("messageGroup");

    private final String value;

    DeduplicationScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
