package com.infrakit.synth.resource.lambda;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.PropertyValues;
import com.infrakit.synth.model.Reference;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FunctionProperties {

    @JsonProperty("FunctionName")
    String functionName;

    @JsonProperty("Architectures")
    List<Architecture> architectures;

    @JsonProperty("MemorySize")
    int memorySize;

    @JsonProperty("Timeout")
    int timeout;

    @JsonProperty("Code")
    Code code;

    @JsonProperty("Handler")
    String handler;

    @JsonProperty("Runtime")
    Runtime runtime;

    @JsonProperty("Role")
    Reference role;

    @JsonProperty("Environment")
    Environment environment;

    @JsonProperty("ReservedConcurrentExecutions")
    Integer reservedConcurrentExecutions;

    @JsonProperty("LoggingConfig")
    LoggingConfig loggingConfig;

    @Value
    public static class Environment {

        /**
         * Literal strings or references.
         */
        @JsonProperty("Variables")
        Map<String, Object> variables;

        public Environment(Map<String, ?> variables) {
            this.variables = PropertyValues.copyAll(variables);
        }

        public Map<String, Object> getVariables() {
            return PropertyValues.copyAll(variables);
        }
    }

    @Value
    public static class LoggingConfig {

        @JsonProperty("LogGroup")
        Reference logGroup;
    }
}
