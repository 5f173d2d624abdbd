package com.infrakit.synth.stack;

import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

/**
 * A resource references an id that no registered resource carries.
 */
public class MissingReferenceException extends IntegrityException {

    private static final long serialVersionUID = 1L;

    private final SynthesizedId missingId;
    private final ResourceId referencedBy;

    public MissingReferenceException(SynthesizedId missingId, ResourceId referencedBy) {
        super("Resource '%s' references %s, which is not registered in this stack. Did you forget to register the %s?"
                .formatted(referencedBy, missingId, missingId.kindHint()));
        this.missingId = missingId;
        this.referencedBy = referencedBy;
    }

    public SynthesizedId getMissingId() {
        return missingId;
    }

    public ResourceId getReferencedBy() {
        return referencedBy;
    }

    public String getKindHint() {
        return missingId.kindHint();
    }
}
