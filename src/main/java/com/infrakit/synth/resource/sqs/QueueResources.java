package com.infrakit.synth.resource.sqs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceGroup;

import lombok.NonNull;
import lombok.Value;

/**
 * A queue and, when a policy was configured, the policy resource attached to it.
 */
@Value
public class QueueResources implements ResourceGroup {

    @NonNull
    Queue queue;

    QueuePolicy policy;

    public Optional<QueuePolicy> getPolicy() {
        return Optional.ofNullable(policy);
    }

    @Override
    public List<Resource> getResources() {
        List<Resource> resources = new ArrayList<>();
        resources.add(queue);
        if (policy != null) {
            resources.add(policy);
        }
        return resources;
    }
}
