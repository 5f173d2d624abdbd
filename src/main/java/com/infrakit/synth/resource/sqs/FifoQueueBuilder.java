package com.infrakit.synth.resource.sqs;

import java.util.List;

/**
 * FIFO queue. The queue name, when set, gets the mandatory {@code .fifo} suffix.
 * Per-message-group throughput only works with message-group deduplication.
 */
public class FifoQueueBuilder {

    private final QueueBuilder start;
    private Boolean contentBasedDeduplication;
    private DeduplicationScope deduplicationScope;
    private FifoThroughputLimit fifoThroughputLimit;

    FifoQueueBuilder(QueueBuilder start) {
        this.start = start;
    }

    public FifoQueueBuilder contentBasedDeduplication(boolean contentBasedDeduplication) {
        this.contentBasedDeduplication = contentBasedDeduplication;
        return this;
    }

    public FifoQueueBuilder deduplicationScope(DeduplicationScope deduplicationScope) {
        this.deduplicationScope = deduplicationScope;
        return this;
    }

    public FifoQueueBuilder fifoThroughputLimit(FifoThroughputLimit fifoThroughputLimit) {
        this.fifoThroughputLimit = fifoThroughputLimit;
        return this;
    }

    /**
     * Shortcut for message-group deduplication with per-message-group throughput.
     */
    public FifoQueueBuilder highThroughput() {
        this.deduplicationScope = DeduplicationScope.MESSAGE_GROUP;
        this.fifoThroughputLimit = FifoThroughputLimit.PER_MESSAGE_GROUP_ID;
        return this;
    }

    public QueueResources build() {
        List<String> violations = QueueBuilder.newViolations();
        if (fifoThroughputLimit == FifoThroughputLimit.PER_MESSAGE_GROUP_ID
                && deduplicationScope != DeduplicationScope.MESSAGE_GROUP) {
            violations.add("per message group throughput requires message group deduplication scope");
        }
        start.validateCommon(violations, true);

        String name = start.queueName;
        if (name != null && !name.endsWith(QueueBuilder.FIFO_SUFFIX)) {
            name = name + QueueBuilder.FIFO_SUFFIX;
        }
        if (name != null && name.length() > 80) {
            violations.add("queue name must be at most 80 characters");
        }

        QueueProperties.QueuePropertiesBuilder properties = QueueProperties.builder()
                .queueName(name)
                .fifoQueue(true)
                .contentBasedDeduplication(contentBasedDeduplication)
                .deduplicationScope(deduplicationScope)
                .fifoThroughputLimit(fifoThroughputLimit);
        return start.build(properties, violations);
    }
}
