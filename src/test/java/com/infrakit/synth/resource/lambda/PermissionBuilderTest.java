package com.infrakit.synth.resource.lambda;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.serialization.TemplateJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PermissionBuilderTest {

    private static Function function() {
        return FunctionBuilder.create("api", Architecture.ARM64, 128, 3)
                .code(Code.inline("exports.handler = async () => {}"))
                .handler("index.handler")
                .runtime(Runtime.NODEJS_22)
                .build()
                .getFunction();
    }

    @Test
    void testDefaultsToInvokeFunction() {
        Function function = function();

        Permission permission = PermissionBuilder.create(ResourceId.of("invoke"), function, "events.amazonaws.com")
                .build();

        JsonNode json = TemplateJson.toTree(permission.getProperties());
        assertThat(json.get("Action").asText()).isEqualTo(PermissionBuilder.INVOKE_FUNCTION);
        assertThat(json.get("Principal").asText()).isEqualTo("events.amazonaws.com");
        assertThat(json.get("FunctionName").get("Fn::GetAtt").get(0).asText())
                .isEqualTo(function.getSynthesizedId().getValue());
        assertThat(json.has("SourceArn")).isFalse();
    }

    @Test
    void testSourceArnIsReferenced() {
        Function function = function();

        Permission permission = PermissionBuilder.create(ResourceId.of("invoke"), function, "s3.amazonaws.com")
                .sourceArn(function.arn())
                .build();

        assertThat(permission.getProperties().getSourceArn()).isEqualTo(function.arn());
    }

    @Test
    void testNonLambdaActionIsRejected() {
        PermissionBuilder builder = PermissionBuilder.create(ResourceId.of("invoke"), function(), "sns.amazonaws.com")
                .action("s3:GetObject");

        assertThatThrownBy(builder::build).hasMessageContaining("must be a lambda action");
    }
}
