package com.infrakit.synth.resource.iam;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.serialization.TemplateJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RoleBuilderTest {

    @Test
    void testRoleWithTrustPolicyBuilds() {
        Role role = RoleBuilder.create("worker-role", RoleProperties.builder()
                        .roleName("worker")
                        .assumeRolePolicyDocument(PolicyDocument.assumeRoleFor("lambda.amazonaws.com"))
                        .managedPolicyArn("arn:aws:iam::aws:policy/ReadOnlyAccess")
                        .build())
                .build();

        assertThat(role.getSynthesizedId().kindHint()).isEqualTo("Role");
        assertThat(role.getResourceId().getValue()).isEqualTo("worker-role");

        JsonNode json = TemplateJson.toTree(role.getProperties());
        JsonNode statement = json.get("AssumeRolePolicyDocument").get("Statement").get(0);
        assertThat(json.get("AssumeRolePolicyDocument").get("Version").asText()).isEqualTo("2012-10-17");
        assertThat(statement.get("Effect").asText()).isEqualTo("Allow");
        assertThat(statement.get("Principal").get("Service").asText()).isEqualTo("lambda.amazonaws.com");
        assertThat(statement.get("Action").get(0).asText()).isEqualTo("sts:AssumeRole");
        assertThat(statement.has("Resource")).isFalse();
        assertThat(json.get("ManagedPolicyArns")).hasSize(1);
    }

    @Test
    void testCustomKindPrefixesGeneratedId() {
        Role role = RoleBuilder.create("fnRole", RoleProperties.builder()
                        .assumeRolePolicyDocument(PolicyDocument.assumeRoleFor("lambda.amazonaws.com"))
                        .build())
                .kind("LambdaFunctionRole")
                .build();

        assertThat(role.getSynthesizedId().getValue()).startsWith("LambdaFunctionRole");
    }

    @Test
    void testMissingTrustPolicyIsRejected() {
        RoleBuilder builder = RoleBuilder.create("role", RoleProperties.builder().build());

        assertThatThrownBy(builder::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("assume role policy document");
    }

    @Test
    void testEveryViolationIsReported() {
        Statement noPrincipal = Statement.builder().effect(Effect.ALLOW).action("sts:AssumeRole").build();
        RoleBuilder builder = RoleBuilder.create("role", RoleProperties.builder()
                .assumeRolePolicyDocument(PolicyDocument.of(noPrincipal))
                .policy(new Policy("empty", PolicyDocument.builder().build()))
                .build());

        assertThatThrownBy(builder::build)
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations())
                        .containsExactly("every assume role statement needs a principal",
                                "inline policy 'empty' has no statements"));
    }
}
