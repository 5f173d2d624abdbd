package com.infrakit.synth.model;

import lombok.NonNull;
import lombok.Value;

/**
 * User-chosen logical name of a resource. Stable across synthesis runs, which is
 * what lets a later deploy recognise "the same" resource.
 */
@Value
public class ResourceId {

    public static final String SEPARATOR = "-";

    @NonNull
    String value;

    public static ResourceId of(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("resource id must not be blank");
        }
        return new ResourceId(value);
    }

    /**
     * Derives the id of a companion resource, e.g. {@code orders} + {@code Role}.
     */
    public ResourceId withSuffix(String suffix) {
        return new ResourceId(value + suffix);
    }

    /**
     * Joins two ids with {@value #SEPARATOR}, e.g. {@code alerts-notifier}.
     */
    public ResourceId combine(ResourceId other) {
        return new ResourceId(value + SEPARATOR + other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
