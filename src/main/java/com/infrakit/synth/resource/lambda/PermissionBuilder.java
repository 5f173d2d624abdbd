package com.infrakit.synth.resource.lambda;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.Reference;
import com.infrakit.synth.model.ResourceId;

public class PermissionBuilder {

    public static final String INVOKE_FUNCTION = "lambda:InvokeFunction";

    private final ResourceId resourceId;
    private final Function function;
    private final String principal;
    private String action = INVOKE_FUNCTION;
    private Reference sourceArn;
    private IdGenerator idGenerator = IdGenerator.shared();

    private PermissionBuilder(ResourceId resourceId, Function function, String principal) {
        this.resourceId = resourceId;
        this.function = function;
        this.principal = principal;
    }

    public static PermissionBuilder create(ResourceId id, Function function, String principal) {
        return new PermissionBuilder(id, function, principal);
    }

    public PermissionBuilder action(String action) {
        this.action = action;
        return this;
    }

    /**
     * Restricts the permission to calls coming from the referenced resource.
     */
    public PermissionBuilder sourceArn(Reference sourceArn) {
        this.sourceArn = sourceArn;
        return this;
    }

    public PermissionBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public Permission build() {
        if (function == null) {
            throw new ConfigurationException("permission requires a function");
        }
        if (principal == null || principal.isBlank()) {
            throw new ConfigurationException("permission requires a principal");
        }
        if (action == null || !action.startsWith("lambda:")) {
            throw new ConfigurationException("permission action must be a lambda action: " + action);
        }
        PermissionProperties properties = new PermissionProperties(action, function.arn(), principal, sourceArn);
        return new Permission(resourceId, idGenerator.generate(Permission.KIND), properties);
    }
}
