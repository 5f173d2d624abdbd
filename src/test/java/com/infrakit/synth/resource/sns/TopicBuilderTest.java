package com.infrakit.synth.resource.sns;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.resource.iam.PolicyDocument;
import com.infrakit.synth.resource.lambda.Architecture;
import com.infrakit.synth.resource.lambda.Code;
import com.infrakit.synth.resource.lambda.Function;
import com.infrakit.synth.resource.lambda.FunctionBuilder;
import com.infrakit.synth.resource.lambda.FunctionResources;
import com.infrakit.synth.resource.lambda.Permission;
import com.infrakit.synth.resource.lambda.Runtime;
import com.infrakit.synth.serialization.TemplateJson;
import com.infrakit.synth.stack.StackBuilder;
import com.infrakit.synth.stack.Template;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SNS topics and their Lambda subscriptions.
 */
class TopicBuilderTest {

    private static FunctionResources function(String id) {
        return FunctionBuilder.create(id, Architecture.ARM64, 128, 10)
                .code(Code.inline("exports.handler = async () => {}"))
                .handler("index.handler")
                .runtime(Runtime.NODEJS_22)
                .build();
    }

    @Test
    void testStandardTopicWithSubscription() throws Exception {
        FunctionResources notifier = function("notifier");

        TopicResources resources = TopicBuilder.create("alerts")
                .topicName("alerts")
                .standard()
                .lambdaSubscription(notifier.getFunction())
                .build();

        Topic topic = resources.getTopic();
        assertThat(topic.isFifo()).isFalse();

        Subscription subscription = resources.getSubscriptions().get(0);
        assertThat(subscription.getResourceId().getValue()).isEqualTo("alerts-notifierSubscription");
        JsonNode json = TemplateJson.toTree(subscription.getProperties());
        assertThat(json.get("Protocol").asText()).isEqualTo("lambda");
        assertThat(json.get("TopicArn").get("Ref").asText()).isEqualTo(topic.getSynthesizedId().getValue());

        Permission permission = resources.getPermissions().get(0);
        assertThat(permission.getResourceId().getValue()).isEqualTo("alerts-notifierPermission");
        assertThat(permission.getProperties().getPrincipal()).isEqualTo("sns.amazonaws.com");
        assertThat(permission.getProperties().getSourceArn()).isEqualTo(topic.ref());

        Template template = new StackBuilder().register(notifier).register(resources).build();
        assertThat(template.size()).isEqualTo(5);
    }

    @Test
    void testFifoTopicGetsSuffixAndFlags() {
        Topic topic = TopicBuilder.create("orders")
                .topicName("orders")
                .fifo()
                .contentBasedDeduplication(true)
                .fifoThroughputScope(FifoThroughputScope.MESSAGE_GROUP)
                .build()
                .getTopic();

        JsonNode json = TemplateJson.toTree(topic.getProperties());
        assertThat(json.get("TopicName").asText()).isEqualTo("orders.fifo");
        assertThat(json.get("FifoTopic").asBoolean()).isTrue();
        assertThat(json.get("FifoThroughputScope").asText()).isEqualTo("MessageGroup");
        assertThat(topic.isFifo()).isTrue();
    }

    @Test
    void testFifoTopicAcceptsLambdaSubscriptions() {
        Function function = function("consumer").getFunction();

        TopicResources resources = TopicBuilder.create("orders").fifo().lambdaSubscription(function).build();

        assertThat(resources.getSubscriptions()).hasSize(1);
        assertThat(resources.getPermissions()).hasSize(1);
    }

    @Test
    void testStandardNameMustNotEndWithFifo() {
        StandardTopicBuilder builder = TopicBuilder.create("alerts").topicName("alerts.fifo").standard();

        assertThatThrownBy(builder::build).hasMessage("standard topic name must not end with .fifo");
    }

    @Test
    void testInvalidSettingsAreCollected() {
        StandardTopicBuilder builder = TopicBuilder.create("alerts")
                .topicName("bad name")
                .displayName("d".repeat(101))
                .policy(PolicyDocument.builder().build())
                .standard();

        assertThatThrownBy(builder::build)
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations()).hasSize(3));
    }

    @Test
    void testSameFunctionSubscribedTwiceIsRejected() {
        Function notifier = function("notifier").getFunction();
        StandardTopicBuilder builder = TopicBuilder.create("alerts")
                .standard()
                .lambdaSubscription(notifier)
                .lambdaSubscription(notifier);

        assertThatThrownBy(builder::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("function 'notifier' is subscribed more than once");
    }

    @Test
    void testNullSubscriptionIsRejected() {
        assertThatThrownBy(() -> TopicBuilder.create("alerts").standard().lambdaSubscription(null))
                .isInstanceOf(ConfigurationException.class);
    }
}
