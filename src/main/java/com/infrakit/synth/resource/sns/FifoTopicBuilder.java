package com.infrakit.synth.resource.sns;

import com.infrakit.synth.resource.lambda.Function;

/**
 * FIFO topic. The topic name, when set, gets the mandatory {@code .fifo} suffix.
 */
public class FifoTopicBuilder {

    private final TopicBuilder start;
    private Boolean contentBasedDeduplication;
    private FifoThroughputScope fifoThroughputScope;

    FifoTopicBuilder(TopicBuilder start) {
        this.start = start;
    }

    public FifoTopicBuilder contentBasedDeduplication(boolean contentBasedDeduplication) {
        this.contentBasedDeduplication = contentBasedDeduplication;
        return this;
    }

    public FifoTopicBuilder fifoThroughputScope(FifoThroughputScope fifoThroughputScope) {
        this.fifoThroughputScope = fifoThroughputScope;
        return this;
    }

    public FifoTopicBuilder lambdaSubscription(Function function) {
        start.addLambdaSubscription(function);
        return this;
    }

    public TopicResources build() {
        return start.build(true, contentBasedDeduplication, fifoThroughputScope);
    }
}
