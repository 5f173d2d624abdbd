package com.infrakit.synth.stack;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infrakit.synth.model.Asset;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.model.ResourceGroup;

/**
 * Accumulates resources for one template.
 *
 * <p>Registration never fails and its order does not matter. All validation happens in
 * {@link #build()}, which either returns a complete template or throws; nothing partial
 * is produced.
 *
 * <pre>{@code
 * Role role = RoleBuilder.create("api-role", props).build();
 * FunctionResources fn = FunctionBuilder.create("api", Architecture.ARM64, 512, 30)
 *         .code(Code.zip("deploy-bucket", Path.of("target/api.zip")))
 *         .handler("index.handler")
 *         .runtime(Runtime.NODEJS_22)
 *         .role(role)
 *         .build();
 *
 * Template template = new StackBuilder()
 *         .register(fn)
 *         .register(role)
 *         .tag("team", "payments")
 *         .build();
 * }</pre>
 */
public class StackBuilder {

    private static final Logger log = LoggerFactory.getLogger(StackBuilder.class);

    private final List<Resource> resources = new ArrayList<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final ReferenceIntegrityChecker integrityChecker;
    private final AssetCollector assetCollector;

    public StackBuilder() {
        this(new ReferenceIntegrityChecker(), new AssetCollector());
    }

    public StackBuilder(ReferenceIntegrityChecker integrityChecker, AssetCollector assetCollector) {
        this.integrityChecker = integrityChecker;
        this.assetCollector = assetCollector;
    }

    public StackBuilder register(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        log.debug("Registered {}", resource);
        resources.add(resource);
        return this;
    }

    public StackBuilder register(ResourceGroup group) {
        return registerMany(group.getResources());
    }

    public StackBuilder registerMany(Collection<? extends Resource> group) {
        for (Resource resource : group) {
            register(resource);
        }
        return this;
    }

    public StackBuilder registerMany(Resource... group) {
        return registerMany(List.of(group));
    }

    public StackBuilder tag(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("tag key must not be blank");
        }
        tags.put(key, value);
        return this;
    }

    public int size() {
        return resources.size();
    }

    /**
     * Closes the registered resources into an immutable template.
     *
     * @throws MissingReferenceException if any resource references an unregistered one
     * @throws DuplicateIdentifierException if two registrations share an id
     */
    public Template build() throws IntegrityException {
        List<Resource> snapshot = List.copyOf(resources);
        integrityChecker.check(snapshot);

        List<Asset> assets = assetCollector.collect(snapshot);
        Template template = new Template(snapshot, tags, assets, Map.of());
        log.info("Finalized template with {} resources and {} assets", template.size(), assets.size());
        return template;
    }
}
