package com.infrakit.synth.serialization;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infrakit.synth.config.SynthConfig;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.stack.ReferenceScanner;
import com.infrakit.synth.stack.Template;
import com.infrakit.synth.util.FileWriteUtil;

/**
 * Renders a finalized template into the deployable JSON body:
 *
 * <pre>
 * { "Resources": { "&lt;wire id&gt;": { "Type": ..., "Properties": { ... } } },
 *   "Metadata":  { "&lt;resource id&gt;": "&lt;wire id&gt;" } }
 * </pre>
 *
 * Tags are not part of the body.
 */
public class TemplateSerializer {

    private static final Logger log = LoggerFactory.getLogger(TemplateSerializer.class);

    public static final String RESOURCES = "Resources";
    public static final String METADATA = "Metadata";
    public static final String TYPE = "Type";
    public static final String PROPERTIES = "Properties";

    private final SynthConfig config;

    public TemplateSerializer() {
        this(SynthConfig.defaults());
    }

    public TemplateSerializer(SynthConfig config) {
        this.config = config;
    }

    public ObjectNode toJson(Template template) {
        ObjectNode root = TemplateJson.mapper().createObjectNode();
        ObjectNode resources = root.putObject(RESOURCES);
        Map<SynthesizedId, SynthesizedId> renames = template.getRenamedIds();

        for (Resource resource : template.getResources()) {
            ObjectNode entry = resources.putObject(template.wireIdOf(resource.getSynthesizedId()).getValue());
            entry.put(TYPE, resource.getType());
            JsonNode properties = ReferenceScanner.rewrite(TemplateJson.toTree(resource.getProperties()), renames);
            entry.set(PROPERTIES, properties);
        }

        ObjectNode metadata = root.putObject(METADATA);
        for (Map.Entry<ResourceId, SynthesizedId> entry : template.getMetadata().entrySet()) {
            metadata.put(entry.getKey().getValue(), entry.getValue().getValue());
        }
        return root;
    }

    public String serialize(Template template) {
        try {
            ObjectNode json = toJson(template);
            return config.isPrettyPrint()
                    ? TemplateJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(json)
                    : TemplateJson.mapper().writeValueAsString(json);
        } catch (JsonProcessingException e) {
            // trees built from our own payloads always serialize
            throw new IllegalStateException("Could not serialize template: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Template template, Path target) throws IOException {
        FileWriteUtil.safeWriteString(target, serialize(template));
        log.info("Wrote template with {} resources to {}", template.size(), target);
    }
}
