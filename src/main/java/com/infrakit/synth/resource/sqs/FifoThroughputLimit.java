package com.infrakit.synth.resource.sqs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FifoThroughputLimit {
    PER_QUEUE("perQueue"),
    PER_MESSAGE_GROUP_ID("perMessageGroupId");

    private final String value;

    FifoThroughputLimit(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
