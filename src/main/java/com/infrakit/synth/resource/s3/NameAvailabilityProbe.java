package com.infrakit.synth.resource.s3;

/**
 * Asks the storage service whether a bucket name is still free.
 */
@FunctionalInterface
public interface NameAvailabilityProbe {

    boolean isAvailable(String name);
}
