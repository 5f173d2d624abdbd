package com.infrakit.synth.resource.sns;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceGroup;
import com.infrakit.synth.resource.lambda.Permission;

import lombok.NonNull;
import lombok.Value;

/**
 * A topic with its subscriptions, the invoke permissions they need and its policy.
 */
@Value
public class TopicResources implements ResourceGroup {

    @NonNull
    Topic topic;

    @NonNull
    List<Subscription> subscriptions;

    @NonNull
    List<Permission> permissions;

    TopicPolicy policy;

    public Optional<TopicPolicy> getPolicy() {
        return Optional.ofNullable(policy);
    }

    @Override
    public List<Resource> getResources() {
        List<Resource> resources = new ArrayList<>();
        resources.add(topic);
        resources.addAll(subscriptions);
        resources.addAll(permissions);
        if (policy != null) {
            resources.add(policy);
        }
        return resources;
    }
}
