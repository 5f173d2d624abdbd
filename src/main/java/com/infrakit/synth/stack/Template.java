package com.infrakit.synth.stack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.infrakit.synth.model.Asset;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;

/**
 * Closed, immutable set of resources produced by one synthesis run (or read back from a
 * deployed body). Safe to share between threads.
 *
 * <p>Resources are keyed by their synthesized id. A template reconciled against a
 * deployed one may put some resources on the wire under a different id; see
 * {@link #wireIdOf(SynthesizedId)}.
 */
public final class Template {

    private static final Template EMPTY = new Template(List.of(), Map.of(), List.of(), Map.of());

    private final Map<SynthesizedId, Resource> resources;
    private final Map<String, String> tags;
    private final List<Asset> assets;
    private final Map<SynthesizedId, SynthesizedId> wireIds;

    Template(List<Resource> resources, Map<String, String> tags, List<Asset> assets,
             Map<SynthesizedId, SynthesizedId> wireIds) {
        Map<SynthesizedId, Resource> byId = new LinkedHashMap<>();
        for (Resource resource : resources) {
            byId.put(resource.getSynthesizedId(), resource);
        }
        this.resources = Collections.unmodifiableMap(byId);
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.assets = List.copyOf(assets);
        this.wireIds = Collections.unmodifiableMap(new LinkedHashMap<>(wireIds));
    }

    public static Template empty() {
        return EMPTY;
    }

    /**
     * Wraps resources read back from a serialized body. No integrity check is run; the
     * body is trusted to be what a deploy accepted.
     */
    public static Template restore(List<Resource> resources, Map<String, String> tags) {
        return new Template(resources, tags, List.of(), Map.of());
    }

    /**
     * Resources in registration order.
     */
    public List<Resource> getResources() {
        return List.copyOf(resources.values());
    }

    public Optional<Resource> get(SynthesizedId synthesizedId) {
        return Optional.ofNullable(resources.get(synthesizedId));
    }

    public Optional<Resource> findByResourceId(ResourceId resourceId) {
        return resources.values().stream()
                .filter(r -> r.getResourceId().equals(resourceId))
                .findFirst();
    }

    public List<ResourceId> getResourceIds() {
        List<ResourceId> ids = new ArrayList<>();
        for (Resource resource : resources.values()) {
            ids.add(resource.getResourceId());
        }
        return ids;
    }

    /**
     * ResourceId to wire id, in registration order. This is what the serialized
     * {@code Metadata} section carries.
     */
    public Map<ResourceId, SynthesizedId> getMetadata() {
        Map<ResourceId, SynthesizedId> metadata = new LinkedHashMap<>();
        for (Resource resource : resources.values()) {
            metadata.put(resource.getResourceId(), wireIdOf(resource.getSynthesizedId()));
        }
        return metadata;
    }

    /**
     * The id a resource is emitted under: its own synthesized id unless reconciliation
     * kept an earlier deployed one.
     */
    public SynthesizedId wireIdOf(SynthesizedId synthesizedId) {
        return wireIds.getOrDefault(synthesizedId, synthesizedId);
    }

    /**
     * Synthesized ids emitted under a different wire id.
     */
    public Map<SynthesizedId, SynthesizedId> getRenamedIds() {
        return wireIds;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public List<Asset> getAssets() {
        return assets;
    }

    public int size() {
        return resources.size();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    Template withWireIds(Map<SynthesizedId, SynthesizedId> renamed) {
        return new Template(getResources(), tags, assets, renamed);
    }

    @Override
    public String toString() {
        return "Template(resources=" + resources.size() + ", assets=" + assets.size() + ", tags=" + tags + ")";
    }
}
