package com.infrakit.synth.resource.iam;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class PolicyDocument {

    public static final String VERSION = "2012-10-17";

    @Builder.Default
    @JsonProperty("Version")
    String version = VERSION;

    @Singular
    @JsonProperty("Statement")
    List<Statement> statements;

    public static PolicyDocument of(Statement... statements) {
        return PolicyDocument.builder().statements(List.of(statements)).build();
    }

    /**
     * Trust policy letting the given AWS service assume a role.
     */
    public static PolicyDocument assumeRoleFor(String service) {
        return of(Statement.allow(Principal.service(service), "sts:AssumeRole"));
    }
}
