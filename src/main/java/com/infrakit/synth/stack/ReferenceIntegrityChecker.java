package com.infrakit.synth.stack;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

/**
 * Confirms that a resource set is closed: identifiers are unique and every embedded
 * reference resolves to a member of the set.
 */
public class ReferenceIntegrityChecker {

    private static final Logger log = LoggerFactory.getLogger(ReferenceIntegrityChecker.class);

    /**
     * Fails on the first problem found, scanning in registration order.
     */
    public void check(List<Resource> resources) throws IntegrityException {
        checkUnique(resources);

        Set<SynthesizedId> registered = new HashSet<>();
        for (Resource resource : resources) {
            registered.add(resource.getSynthesizedId());
        }

        for (Resource resource : resources) {
            for (SynthesizedId referenced : ReferenceScanner.referencedIds(resource)) {
                if (!registered.contains(referenced)) {
                    log.warn("Missing reference: {} -> {}", resource.getResourceId(), referenced);
                    throw new MissingReferenceException(referenced, resource.getResourceId());
                }
            }
        }
    }

    /**
     * Every dangling reference, keyed by the referencing resource, for reporting.
     */
    public Map<ResourceId, List<SynthesizedId>> findMissing(List<Resource> resources) {
        Set<SynthesizedId> registered = new HashSet<>();
        for (Resource resource : resources) {
            registered.add(resource.getSynthesizedId());
        }

        Map<ResourceId, List<SynthesizedId>> missing = new LinkedHashMap<>();
        for (Resource resource : resources) {
            for (SynthesizedId referenced : ReferenceScanner.referencedIds(resource)) {
                if (!registered.contains(referenced)) {
                    missing.computeIfAbsent(resource.getResourceId(), k -> new ArrayList<>()).add(referenced);
                }
            }
        }
        return missing;
    }

    private void checkUnique(List<Resource> resources) throws DuplicateIdentifierException {
        Set<SynthesizedId> synthesizedIds = new HashSet<>();
        Set<ResourceId> resourceIds = new HashSet<>();
        for (Resource resource : resources) {
            if (!synthesizedIds.add(resource.getSynthesizedId())) {
                throw new DuplicateIdentifierException(DuplicateIdentifierException.IdentifierKind.SYNTHESIZED_ID,
                        resource.getSynthesizedId().getValue());
            }
            if (!resourceIds.add(resource.getResourceId())) {
                throw new DuplicateIdentifierException(DuplicateIdentifierException.IdentifierKind.RESOURCE_ID,
                        resource.getResourceId().getValue());
            }
        }
    }
}
