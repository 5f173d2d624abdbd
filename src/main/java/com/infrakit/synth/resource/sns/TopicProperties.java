package com.infrakit.synth.resource.sns;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TopicProperties {

    @JsonProperty("TopicName")
    String topicName;

    @JsonProperty("DisplayName")
    String displayName;

    @JsonProperty("FifoTopic")
    Boolean fifoTopic;

    @JsonProperty("ContentBasedDeduplication")
    Boolean contentBasedDeduplication;

    @JsonProperty("FifoThroughputScope")
    FifoThroughputScope fifoThroughputScope;
}
