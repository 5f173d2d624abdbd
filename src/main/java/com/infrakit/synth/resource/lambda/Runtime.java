package com.infrakit.synth.resource.lambda;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Runtime {
    NODEJS_22("nodejs22.x"),
    JAVA_21("java21"),
    PYTHON_3_13("python3.13"),
    PROVIDED_AL2023("provided.al2023");

    private final String value;

    Runtime(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
