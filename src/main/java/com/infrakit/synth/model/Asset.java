package com.infrakit.synth.model;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * Local build artifact referenced by a resource, to be uploaded to
 * {@code bucket}/{@code key} before the template is submitted.
 */
@Value
public class Asset {

    @NonNull
    Path localPath;

    @NonNull
    String bucket;

    @NonNull
    String key;

    public String getDestinationKey() {
        return bucket + "/" + key;
    }

    @Override
    public String toString() {
        return localPath + " -> s3://" + getDestinationKey();
    }
}
