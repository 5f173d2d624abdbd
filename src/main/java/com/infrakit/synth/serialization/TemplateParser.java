package com.infrakit.synth.serialization;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.infrakit.synth.model.GenericResource;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceId;
import com.infrakit.synth.model.SynthesizedId;
import com.infrakit.synth.stack.Template;

/**
 * Reads a serialized template body (typically fetched from a deployed stack) back into
 * a {@link Template} of {@link GenericResource}s. ResourceIds come from the
 * {@code Metadata} section; a resource that has no metadata entry is named by its wire id.
 */
public class TemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    public Template parse(Path path) throws TemplateParseException {
        String body;
        try {
            body = Files.readString(path);
        } catch (IOException e) {
            throw new TemplateParseException("Could not read template file " + path + ": " + e.getMessage(), e);
        }
        return parse(body);
    }

    public Template parse(String body) throws TemplateParseException {
        if (body == null || body.isBlank()) {
            throw new TemplateParseException("Template body is empty");
        }

        JsonNode root;
        try {
            root = TemplateJson.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new TemplateParseException("Template body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TemplateParseException("Template body must be a JSON object");
        }

        JsonNode resources = root.get(TemplateSerializer.RESOURCES);
        if (resources == null || !resources.isObject()) {
            throw new TemplateParseException("Template has no '" + TemplateSerializer.RESOURCES + "' object");
        }

        Map<String, String> resourceIdsByWireId = readMetadata(root.get(TemplateSerializer.METADATA));

        List<Resource> parsed = new ArrayList<>();
        Set<ResourceId> seen = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> entries = resources.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            Resource resource = readResource(entry.getKey(), entry.getValue(), resourceIdsByWireId);
            if (!seen.add(resource.getResourceId())) {
                throw new TemplateParseException("Resource id '" + resource.getResourceId()
                        + "' names more than one resource (wire id '" + entry.getKey() + "')");
            }
            parsed.add(resource);
        }

        log.debug("Parsed template with {} resources", parsed.size());
        return Template.restore(parsed, Map.of());
    }

    private Resource readResource(String wireId, JsonNode node, Map<String, String> resourceIdsByWireId)
            throws TemplateParseException {
        if (wireId.isBlank()) {
            throw new TemplateParseException("Resource with a blank logical id");
        }
        if (!node.isObject()) {
            throw new TemplateParseException("Resource '" + wireId + "' must be a JSON object");
        }
        JsonNode type = node.get(TemplateSerializer.TYPE);
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new TemplateParseException("Resource '" + wireId + "' has no '" + TemplateSerializer.TYPE + "'");
        }
        JsonNode properties = node.get(TemplateSerializer.PROPERTIES);
        if (properties != null && !properties.isObject()) {
            throw new TemplateParseException("Properties of resource '" + wireId + "' must be a JSON object");
        }

        String resourceId = resourceIdsByWireId.getOrDefault(wireId, wireId);
        return new GenericResource(new ResourceId(resourceId), new SynthesizedId(wireId), type.asText(), properties);
    }

    private Map<String, String> readMetadata(JsonNode metadata) throws TemplateParseException {
        Map<String, String> resourceIdsByWireId = new HashMap<>();
        if (metadata == null || metadata.isNull()) {
            return resourceIdsByWireId;
        }
        if (!metadata.isObject()) {
            throw new TemplateParseException("'" + TemplateSerializer.METADATA + "' must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = metadata.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            // other tools put structured metadata here; only string entries map ids
            if (entry.getValue().isTextual()) {
                String previous = resourceIdsByWireId.put(entry.getValue().asText(), entry.getKey());
                if (previous != null) {
                    throw new TemplateParseException("Metadata entries '" + previous + "' and '" + entry.getKey()
                            + "' both point at wire id '" + entry.getValue().asText() + "'");
                }
            }
        }
        return resourceIdsByWireId;
    }
}
