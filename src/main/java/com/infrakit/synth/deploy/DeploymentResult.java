package com.infrakit.synth.deploy;

import lombok.NonNull;
import lombok.Value;

@Value
public class DeploymentResult {

    public enum Operation {
        CREATED,
        UPDATED,
        UNCHANGED
    }

    @NonNull
    String stackName;

    @NonNull
    Operation operation;

    /**
     * Last polled status, {@code null} when nothing had to be updated.
     */
    StackStatus finalStatus;

    int uploadedAssets;
}
