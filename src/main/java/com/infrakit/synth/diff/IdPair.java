package com.infrakit.synth.diff;

import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

import lombok.NonNull;
import lombok.Value;

/**
 * A resource's logical name with the wire id it has in one template.
 */
@Value
public class IdPair {

    @NonNull
    ResourceId resourceId;

    @NonNull
    SynthesizedId synthesizedId;

    @Override
    public String toString() {
        return resourceId + " (resource " + synthesizedId + ")";
    }
}
