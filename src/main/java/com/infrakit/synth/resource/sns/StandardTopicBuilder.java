package com.infrakit.synth.resource.sns;

import com.infrakit.synth.resource.lambda.Function;

/**
 * Standard topic: deduplication and throughput scope are FIFO-only and not offered here.
 */
public class StandardTopicBuilder {

    private final TopicBuilder start;

    StandardTopicBuilder(TopicBuilder start) {
        this.start = start;
    }

    /**
     * Delivers messages to the function; adds the subscription and the invoke permission.
     */
    public StandardTopicBuilder lambdaSubscription(Function function) {
        start.addLambdaSubscription(function);
        return this;
    }

    public TopicResources build() {
        return start.build(false, null, null);
    }
}
