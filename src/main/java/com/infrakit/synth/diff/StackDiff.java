package com.infrakit.synth.diff;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Structural comparison of two templates by ResourceId.
 *
 * <p>Only presence is compared. A resource whose ResourceId survives but whose
 * properties changed is reported as unchanged.
 */
@Value
@Builder
public class StackDiff {

    /**
     * In the current template only. Pairs carry the current wire id.
     */
    @NonNull
    @Singular("introducedId")
    List<IdPair> introduced;

    /**
     * In the previous template only. Pairs carry the previous wire id.
     */
    @NonNull
    @Singular("removedId")
    List<IdPair> removed;

    /**
     * In both. Pairs carry the current wire id.
     */
    @NonNull
    @Singular("unchangedId")
    List<IdPair> unchanged;

    public boolean hasChanges() {
        return !introduced.isEmpty() || !removed.isEmpty();
    }

    /**
     * Three-line plain text summary, {@code (none)} for empty sets.
     */
    public String format() {
        return "- added ids: " + formatIds(introduced) + System.lineSeparator()
                + "- removed ids: " + formatIds(removed) + System.lineSeparator()
                + "- ids that stay: " + formatIds(unchanged);
    }

    static String formatIds(List<IdPair> ids) {
        if (ids.isEmpty()) {
            return "(none)";
        }
        return ids.stream().map(IdPair::toString).collect(Collectors.joining(", "));
    }
}
