package com.infrakit.synth.resource.sqs;

import java.util.ArrayList;
import java.util.List;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.resource.iam.PolicyDocument;

/**
 * Starting state of an SQS queue. Settings shared by both queue types are set here;
 * {@link #standard()} or {@link #fifo()} then opens the type-specific options and
 * {@code build()}.
 */
public class QueueBuilder {

    static final String FIFO_SUFFIX = ".fifo";

    final ResourceId resourceId;
    IdGenerator idGenerator = IdGenerator.shared();
    String queueName;
    Integer delaySeconds;
    Integer maximumMessageSize;
    Integer messageRetentionPeriod;
    Integer receiveMessageWaitTimeSeconds;
    Integer visibilityTimeout;
    Queue deadLetterQueue;
    int maxReceiveCount;
    PolicyDocument policyDocument;

    private QueueBuilder(ResourceId resourceId) {
        this.resourceId = resourceId;
    }

    public static QueueBuilder create(String id) {
        return new QueueBuilder(ResourceId.of(id));
    }

    public QueueBuilder queueName(String queueName) {
        this.queueName = queueName;
        return this;
    }

    public QueueBuilder delaySeconds(int delaySeconds) {
        this.delaySeconds = delaySeconds;
        return this;
    }

    public QueueBuilder maximumMessageSize(int maximumMessageSize) {
        this.maximumMessageSize = maximumMessageSize;
        return this;
    }

    public QueueBuilder messageRetentionPeriod(int seconds) {
        this.messageRetentionPeriod = seconds;
        return this;
    }

    public QueueBuilder receiveMessageWaitTimeSeconds(int seconds) {
        this.receiveMessageWaitTimeSeconds = seconds;
        return this;
    }

    public QueueBuilder visibilityTimeout(int seconds) {
        this.visibilityTimeout = seconds;
        return this;
    }

    /**
     * Messages received more than {@code maxReceiveCount} times move to {@code deadLetterQueue}.
     */
    public QueueBuilder deadLetterQueue(Queue deadLetterQueue, int maxReceiveCount) {
        this.deadLetterQueue = deadLetterQueue;
        this.maxReceiveCount = maxReceiveCount;
        return this;
    }

    /**
     * Attaches a resource policy; building then also yields a {@link QueuePolicy}.
     */
    public QueueBuilder policy(PolicyDocument policyDocument) {
        this.policyDocument = policyDocument;
        return this;
    }

    public QueueBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public StandardQueueBuilder standard() {
        return new StandardQueueBuilder(this);
    }

    public FifoQueueBuilder fifo() {
        return new FifoQueueBuilder(this);
    }

    void validateCommon(List<String> violations, boolean fifo) {
        if (deadLetterQueue != null && deadLetterQueue.isFifo() != fifo) {
            violations.add(fifo
                    ? "dead letter queue of a FIFO queue must be a FIFO queue"
                    : "dead letter queue of a standard queue must be a standard queue");
        }
        if (policyDocument != null && policyDocument.getStatements().isEmpty()) {
            violations.add("queue policy has no statements");
        }
    }

    QueueResources build(QueueProperties.QueuePropertiesBuilder typeSpecific, List<String> violations) {
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
        QueueProperties.QueuePropertiesBuilder properties = typeSpecific
                .delaySeconds(delaySeconds)
                .maximumMessageSize(maximumMessageSize)
                .messageRetentionPeriod(messageRetentionPeriod)
                .receiveMessageWaitTimeSeconds(receiveMessageWaitTimeSeconds)
                .visibilityTimeout(visibilityTimeout);
        if (deadLetterQueue != null) {
            properties.redrivePolicy(new QueueProperties.RedrivePolicy(deadLetterQueue.arn(), maxReceiveCount));
        }
        Queue queue = new Queue(resourceId, idGenerator.generate(Queue.KIND), properties.build());

        QueuePolicy policy = null;
        if (policyDocument != null) {
            policy = new QueuePolicy(resourceId.withSuffix("Policy"), idGenerator.generate(QueuePolicy.KIND),
                    new QueuePolicyProperties(List.of(queue.ref()), policyDocument));
        }
        return new QueueResources(queue, policy);
    }

    static List<String> newViolations() {
        return new ArrayList<>();
    }
}
