package com.infrakit.synth.stack;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.infrakit.synth.model.Asset;
import com.infrakit.synth.model.Resource;

/**
 * Gathers the local artifacts registered resources point at. Identical artifacts shared
 * by several resources appear once. Existence of the local files is not checked here.
 */
public class AssetCollector {

    public List<Asset> collect(Iterable<? extends Resource> resources) {
        Set<Asset> assets = new LinkedHashSet<>();
        for (Resource resource : resources) {
            assets.addAll(resource.getAssets());
        }
        return new ArrayList<>(assets);
    }

    public List<Asset> collect(Template template) {
        return collect(template.getResources());
    }
}
