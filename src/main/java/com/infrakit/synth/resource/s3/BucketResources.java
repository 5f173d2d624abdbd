package com.infrakit.synth.resource.s3;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceGroup;

import lombok.NonNull;
import lombok.Value;

@Value
public class BucketResources implements ResourceGroup {

    @NonNull
    Bucket bucket;

    BucketPolicy policy;

    public Optional<BucketPolicy> getPolicy() {
        return Optional.ofNullable(policy);
    }

    @Override
    public List<Resource> getResources() {
        List<Resource> resources = new ArrayList<>();
        resources.add(bucket);
        if (policy != null) {
            resources.add(policy);
        }
        return resources;
    }
}
