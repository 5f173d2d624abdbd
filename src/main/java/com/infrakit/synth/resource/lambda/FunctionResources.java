package com.infrakit.synth.resource.lambda;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceGroup;
import com.infrakit.synth.resource.cloudwatch.LogGroup;
import com.infrakit.synth.resource.iam.Role;

import lombok.NonNull;
import lombok.Value;

/**
 * A function together with the resources generated for it. Roles and log groups passed
 * in by the caller are not part of the group; the caller registers those itself.
 */
@Value
public class FunctionResources implements ResourceGroup {

    @NonNull
    Function function;

    Role generatedRole;

    LogGroup generatedLogGroup;

    @NonNull
    List<EventSourceMapping> eventSourceMappings;

    public Optional<Role> getGeneratedRole() {
        return Optional.ofNullable(generatedRole);
    }

    public Optional<LogGroup> getGeneratedLogGroup() {
        return Optional.ofNullable(generatedLogGroup);
    }

    @Override
    public List<Resource> getResources() {
        List<Resource> resources = new ArrayList<>();
        resources.add(function);
        if (generatedRole != null) {
            resources.add(generatedRole);
        }
        if (generatedLogGroup != null) {
            resources.add(generatedLogGroup);
        }
        resources.addAll(eventSourceMappings);
        return resources;
    }
}
