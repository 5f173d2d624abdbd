package com.infrakit.synth.model;

import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * One declared infrastructure unit. Subclasses are the supported resource kinds; each
 * carries a kind-specific property payload that may embed {@link Reference}s to other
 * resources.
 */
@Getter
public abstract class Resource {

    public static final String ARN = "Arn";

    @NonNull
    private final ResourceId resourceId;

    @NonNull
    private final SynthesizedId synthesizedId;

    @NonNull
    private final String type;

    protected Resource(@NonNull ResourceId resourceId, @NonNull SynthesizedId synthesizedId, @NonNull String type) {
        this.resourceId = resourceId;
        this.synthesizedId = synthesizedId;
        this.type = type;
    }

    /**
     * The payload rendered under {@code Properties}. Any {@link Reference} reachable from
     * it counts as a dependency of this resource.
     */
    public abstract Object getProperties();

    /**
     * Local artifacts this resource needs uploaded. Most kinds have none.
     */
    public List<Asset> getAssets() {
        return List.of();
    }

    public Reference ref() {
        return new Reference(synthesizedId, null);
    }

    public Reference arn() {
        return attribute(ARN);
    }

    public Reference attribute(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("attribute name must not be blank");
        }
        return new Reference(synthesizedId, name);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + resourceId + " -> " + synthesizedId + ", " + type + ")";
    }
}
