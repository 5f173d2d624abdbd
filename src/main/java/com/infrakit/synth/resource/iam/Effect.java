package com.infrakit.synth.resource.iam;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Effect {
    ALLOW("Allow"),
    DENY("Deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
