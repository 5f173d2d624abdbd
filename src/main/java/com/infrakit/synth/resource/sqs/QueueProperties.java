package com.infrakit.synth.resource.sqs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infrakit.synth.model.Reference;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueueProperties {

    @JsonProperty("QueueName")
    String queueName;

    @JsonProperty("FifoQueue")
    Boolean fifoQueue;

    @JsonProperty("ContentBasedDeduplication")
    Boolean contentBasedDeduplication;

    @JsonProperty("DeduplicationScope")
    DeduplicationScope deduplicationScope;

    @JsonProperty("FifoThroughputLimit")
    FifoThroughputLimit fifoThroughputLimit;

    @JsonProperty("DelaySeconds")
    Integer delaySeconds;

    @JsonProperty("MaximumMessageSize")
    Integer maximumMessageSize;

    @JsonProperty("MessageRetentionPeriod")
    Integer messageRetentionPeriod;

    @JsonProperty("ReceiveMessageWaitTimeSeconds")
    Integer receiveMessageWaitTimeSeconds;

    @JsonProperty("VisibilityTimeout")
    Integer visibilityTimeout;

    @JsonProperty("RedrivePolicy")
    RedrivePolicy redrivePolicy;

    @Value
    public static class RedrivePolicy {

        @JsonProperty("deadLetterTargetArn")
        Reference deadLetterTargetArn;

        @JsonProperty("maxReceiveCount")
        int maxReceiveCount;
    }
}
