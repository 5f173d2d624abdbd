package com.infrakit.synth.stack;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

/**
 * Lets a freshly synthesized template keep the wire ids of an already deployed one.
 *
 * <p>Synthesized ids are random per run, so without this every redeploy would replace
 * every resource. Resources whose ResourceId was deployed before take over the deployed
 * id; references to them are rewritten when the template is serialized.
 */
public class IdentifierReconciler {

    private static final Logger log = LoggerFactory.getLogger(IdentifierReconciler.class);

    public Template reconcile(Template current, Template deployed) {
        return reconcile(current, deployed.getMetadata());
    }

    public Template reconcile(Template current, Map<ResourceId, SynthesizedId> deployedIds) {
        if (current.isEmpty() || deployedIds.isEmpty()) {
            return current;
        }

        Set<SynthesizedId> taken = new HashSet<>(current.getMetadata().values());
        Map<SynthesizedId, SynthesizedId> renames = new LinkedHashMap<>(current.getRenamedIds());

        for (Resource resource : current.getResources()) {
            SynthesizedId deployed = deployedIds.get(resource.getResourceId());
            SynthesizedId wireId = current.wireIdOf(resource.getSynthesizedId());
            if (deployed == null || deployed.equals(wireId)) {
                continue;
            }
            if (taken.contains(deployed)) {
                log.warn("Cannot reuse deployed id {} for {}: already used in this template",
                        deployed, resource.getResourceId());
                continue;
            }
            taken.remove(wireId);
            taken.add(deployed);
            renames.put(resource.getSynthesizedId(), deployed);
            log.debug("Reusing deployed id {} for {}", deployed, resource.getResourceId());
        }

        return current.withWireIds(renames);
    }
}
