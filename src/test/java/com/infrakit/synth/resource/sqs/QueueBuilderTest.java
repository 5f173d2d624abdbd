package com.infrakit.synth.resource.sqs;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.resource.iam.PolicyDocument;
import com.infrakit.synth.resource.iam.Principal;
import com.infrakit.synth.resource.iam.Statement;
import com.infrakit.synth.serialization.TemplateJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for standard and FIFO queue builders.
 */
class QueueBuilderTest {

    @Test
    void testStandardQueue() {
        QueueResources resources = QueueBuilder.create("orders")
                .queueName("orders")
                .visibilityTimeout(60)
                .standard()
                .build();

        Queue queue = resources.getQueue();
        assertThat(queue.isFifo()).isFalse();
        assertThat(queue.getProperties().getQueueName()).isEqualTo("orders");
        assertThat(queue.getProperties().getFifoQueue()).isNull();
        assertThat(resources.getPolicy()).isEmpty();
        assertThat(resources.getResources()).containsExactly(queue);
    }

    @Test
    void testFifoQueueGetsSuffix() {
        Queue queue = QueueBuilder.create("payments")
                .queueName("payments")
                .fifo()
                .contentBasedDeduplication(true)
                .build()
                .getQueue();

        assertThat(queue.isFifo()).isTrue();
        assertThat(queue.getProperties().getQueueName()).isEqualTo("payments.fifo");
        assertThat(queue.getProperties().getContentBasedDeduplication()).isTrue();
    }

    @Test
    void testFifoSuffixIsNotDoubled() {
        Queue queue = QueueBuilder.create("payments").queueName("payments.fifo").fifo().build().getQueue();

        assertThat(queue.getProperties().getQueueName()).isEqualTo("payments.fifo");
    }

    @Test
    void testStandardQueueNameMustNotEndWithFifo() {
        StandardQueueBuilder builder = QueueBuilder.create("q").queueName("q.fifo").standard();

        assertThatThrownBy(builder::build).hasMessage("standard queue name must not end with .fifo");
    }

    @Test
    void testHighThroughputSetsBothSettings() {
        JsonNode json = TemplateJson.toTree(QueueBuilder.create("q").fifo().highThroughput().build()
                .getQueue().getProperties());

        assertThat(json.get("DeduplicationScope").asText()).isEqualTo("messageGroup");
        assertThat(json.get("FifoThroughputLimit").asText()).isEqualTo("perMessageGroupId");
        assertThat(json.get("FifoQueue").asBoolean()).isTrue();
    }

    @Test
    void testPerMessageGroupThroughputNeedsMessageGroupScope() {
        FifoQueueBuilder builder = QueueBuilder.create("q")
                .fifo()
                .deduplicationScope(DeduplicationScope.QUEUE)
                .fifoThroughputLimit(FifoThroughputLimit.PER_MESSAGE_GROUP_ID);

        assertThatThrownBy(builder::build)
                .hasMessage("per message group throughput requires message group deduplication scope");
    }

    @Test
    void testTimingsArePassedThroughUnchecked() {
        Queue queue = QueueBuilder.create("q")
                .delaySeconds(901)
                .receiveMessageWaitTimeSeconds(21)
                .standard()
                .build()
                .getQueue();

        assertThat(queue.getProperties().getDelaySeconds()).isEqualTo(901);
        assertThat(queue.getProperties().getReceiveMessageWaitTimeSeconds()).isEqualTo(21);
    }

    @Test
    void testDeadLetterQueueReferencesItsArn() {
        Queue dlq = QueueBuilder.create("dlq").standard().build().getQueue();

        Queue queue = QueueBuilder.create("orders").deadLetterQueue(dlq, 5).standard().build().getQueue();

        JsonNode redrive = TemplateJson.toTree(queue.getProperties()).get("RedrivePolicy");
        assertThat(redrive.get("deadLetterTargetArn").get("Fn::GetAtt").get(0).asText())
                .isEqualTo(dlq.getSynthesizedId().getValue());
        assertThat(redrive.get("maxReceiveCount").asInt()).isEqualTo(5);
    }

    @Test
    void testDeadLetterQueueMustMatchQueueType() {
        Queue standardDlq = QueueBuilder.create("dlq").standard().build().getQueue();
        FifoQueueBuilder builder = QueueBuilder.create("orders").deadLetterQueue(standardDlq, 3).fifo();

        assertThatThrownBy(builder::build).hasMessage("dead letter queue of a FIFO queue must be a FIFO queue");
    }

    @Test
    void testPolicyProducesQueuePolicyResource() {
        PolicyDocument document = PolicyDocument.of(
                Statement.allow(Principal.service("sns.amazonaws.com"), "sqs:SendMessage"));

        QueueResources resources = QueueBuilder.create("orders").policy(document).standard().build();

        QueuePolicy policy = resources.getPolicy().orElseThrow();
        assertThat(policy.getResourceId().getValue()).isEqualTo("ordersPolicy");
        assertThat(policy.getProperties().getQueues()).containsExactly(resources.getQueue().ref());
        assertThat(resources.getResources()).hasSize(2);
    }

    @Test
    void testEmptyPolicyIsRejected() {
        StandardQueueBuilder builder = QueueBuilder.create("orders")
                .policy(PolicyDocument.builder().build())
                .standard();

        assertThatThrownBy(builder::build).hasMessage("queue policy has no statements");
    }
}
