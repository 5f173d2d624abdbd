package com.infrakit.synth.resource.lambda;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Architecture {
    X86_64("x86_64"),
    ARM64("arm64");

    private final String value;

    Architecture(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
