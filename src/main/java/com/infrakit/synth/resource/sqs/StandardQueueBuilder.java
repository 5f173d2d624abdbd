package com.infrakit.synth.resource.sqs;

import java.util.List;

/**
 * Standard queue: no FIFO-only options are reachable from here.
 */
public class StandardQueueBuilder {

    private final QueueBuilder start;

    StandardQueueBuilder(QueueBuilder start) {
        this.start = start;
    }

    public QueueResources build() {
        List<String> violations = QueueBuilder.newViolations();
        if (start.queueName != null && start.queueName.endsWith(QueueBuilder.FIFO_SUFFIX)) {
            violations.add("standard queue name must not end with " + QueueBuilder.FIFO_SUFFIX);
        }
        if (start.queueName != null && start.queueName.length() > 80) {
            violations.add("queue name must be at most 80 characters");
        }
        start.validateCommon(violations, false);
        return start.build(QueueProperties.builder().queueName(start.queueName), violations);
    }
}
