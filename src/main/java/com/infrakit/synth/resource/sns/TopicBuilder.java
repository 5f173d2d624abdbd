package com.infrakit.synth.resource.sns;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.resource.iam.PolicyDocument;
import com.infrakit.synth.resource.lambda.Function;
import com.infrakit.synth.resource.lambda.Permission;
import com.infrakit.synth.resource.lambda.PermissionBuilder;

/**
 * Starting state of an SNS topic. {@link #standard()} or {@link #fifo()} must be chosen
 * before subscriptions can be added and the topic built.
 */
public class TopicBuilder {

    static final String FIFO_SUFFIX = ".fifo";
    static final String SNS_SERVICE = "sns.amazonaws.com";

    private static final Pattern TOPIC_NAME = Pattern.compile("[a-zA-Z0-9_-]+");

    private final ResourceId resourceId;
    private IdGenerator idGenerator = IdGenerator.shared();
    private String topicName;
    private String displayName;
    private PolicyDocument policyDocument;
    private final List<Function> lambdaSubscriptions = new ArrayList<>();

    private TopicBuilder(ResourceId resourceId) {
        this.resourceId = resourceId;
    }

    public static TopicBuilder create(String id) {
        return new TopicBuilder(ResourceId.of(id));
    }

    public TopicBuilder topicName(String topicName) {
        this.topicName = topicName;
        return this;
    }

    public TopicBuilder displayName(String displayName) {
        this.displayName = displayName;
        return this;
    }

    public TopicBuilder policy(PolicyDocument policyDocument) {
        this.policyDocument = policyDocument;
        return this;
    }

    public TopicBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public StandardTopicBuilder standard() {
        return new StandardTopicBuilder(this);
    }

    public FifoTopicBuilder fifo() {
        return new FifoTopicBuilder(this);
    }

    void addLambdaSubscription(Function function) {
        if (function == null) {
            throw new ConfigurationException("subscribed function must not be null");
        }
        lambdaSubscriptions.add(function);
    }

    TopicResources build(boolean fifo, Boolean contentBasedDeduplication, FifoThroughputScope throughputScope) {
        List<String> violations = new ArrayList<>();
        String name = topicName;
        if (name != null) {
            String base = name.endsWith(FIFO_SUFFIX) ? name.substring(0, name.length() - FIFO_SUFFIX.length()) : name;
            if (!TOPIC_NAME.matcher(base).matches()) {
                violations.add("topic name may only contain letters, digits, hyphens and underscores");
            }
            if (!fifo && name.endsWith(FIFO_SUFFIX)) {
                violations.add("standard topic name must not end with " + FIFO_SUFFIX);
            }
            if (fifo && !name.endsWith(FIFO_SUFFIX)) {
                name = name + FIFO_SUFFIX;
            }
            if (name.length() > 256) {
                violations.add("topic name must be at most 256 characters");
            }
        }
        if (displayName != null && displayName.length() > 100) {
            violations.add("display name must be at most 100 characters");
        }
        if (policyDocument != null && policyDocument.getStatements().isEmpty()) {
            violations.add("topic policy has no statements");
        }
        Set<ResourceId> subscribed = new HashSet<>();
        for (Function function : lambdaSubscriptions) {
            if (!subscribed.add(function.getResourceId())) {
                violations.add("function '" + function.getResourceId() + "' is subscribed more than once");
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }

        TopicProperties properties = TopicProperties.builder()
                .topicName(name)
                .displayName(displayName)
                .fifoTopic(fifo ? Boolean.TRUE : null)
                .contentBasedDeduplication(contentBasedDeduplication)
                .fifoThroughputScope(throughputScope)
                .build();
        Topic topic = new Topic(resourceId, idGenerator.generate(Topic.KIND), properties);

        List<Subscription> subscriptions = new ArrayList<>();
        List<Permission> permissions = new ArrayList<>();
        for (Function function : lambdaSubscriptions) {
            ResourceId prefix = resourceId.combine(function.getResourceId());
            permissions.add(PermissionBuilder.create(prefix.withSuffix("Permission"), function, SNS_SERVICE)
                    .sourceArn(topic.ref())
                    .idGenerator(idGenerator)
                    .build());
            subscriptions.add(new Subscription(prefix.withSuffix("Subscription"),
                    idGenerator.generate(Subscription.KIND),
                    new SubscriptionProperties(SubscriptionProperties.LAMBDA_PROTOCOL, function.arn(), topic.ref())));
        }

        TopicPolicy policy = null;
        if (policyDocument != null) {
            policy = new TopicPolicy(resourceId.withSuffix("Policy"), idGenerator.generate(TopicPolicy.KIND),
                    new TopicPolicyProperties(List.of(topic.ref()), policyDocument));
        }
        return new TopicResources(topic, subscriptions, permissions, policy);
    }
}
