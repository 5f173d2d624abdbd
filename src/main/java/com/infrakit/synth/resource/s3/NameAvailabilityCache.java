package com.infrakit.synth.resource.s3;

import java.util.Optional;

/**
 * Remembers which globally unique bucket names were found taken or free, so repeated
 * synthesis runs do not probe the same name again.
 */
public interface NameAvailabilityCache {

    /**
     * @return whether the name is available, or empty when it was never probed
     */
    Optional<Boolean> lookup(String name);

    void record(String name, boolean available);
}
