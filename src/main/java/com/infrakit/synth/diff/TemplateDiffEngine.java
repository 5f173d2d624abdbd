package com.infrakit.synth.diff;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.stack.Template;

/**
 * Classifies resources as introduced, removed or unchanged between two templates.
 *
 * <p>Matching is by ResourceId; synthesized ids are expected to differ between runs.
 * Output order follows the current template's registration order for introduced and
 * unchanged ids, the previous template's for removed ids.
 */
public class TemplateDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(TemplateDiffEngine.class);

    public StackDiff diff(Template current, Template previous) {
        Map<ResourceId, SynthesizedId> currentIds = current.getMetadata();
        Map<ResourceId, SynthesizedId> previousIds = previous.getMetadata();

        StackDiff.StackDiffBuilder diff = StackDiff.builder();

        for (Map.Entry<ResourceId, SynthesizedId> entry : currentIds.entrySet()) {
            IdPair pair = new IdPair(entry.getKey(), entry.getValue());
            if (previousIds.containsKey(entry.getKey())) {
                diff.unchangedId(pair);
            } else {
                diff.introducedId(pair);
            }
        }

        for (Map.Entry<ResourceId, SynthesizedId> entry : previousIds.entrySet()) {
            if (!currentIds.containsKey(entry.getKey())) {
                diff.removedId(new IdPair(entry.getKey(), entry.getValue()));
            }
        }

        StackDiff result = diff.build();
        log.debug("Diff: {} introduced, {} removed, {} unchanged",
                result.getIntroduced().size(), result.getRemoved().size(), result.getUnchanged().size());
        return result;
    }
}
