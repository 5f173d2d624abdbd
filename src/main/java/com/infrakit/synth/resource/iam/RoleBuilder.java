package com.infrakit.synth.resource.iam;

import java.util.ArrayList;
import java.util.List;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.ResourceId;

/**
 * Builds an IAM role from its properties. The trust policy is mandatory and must carry
 * at least one statement with a principal.
 */
public class RoleBuilder {

    private final ResourceId resourceId;
    private final RoleProperties properties;
    private String kind = Role.KIND;
    private IdGenerator idGenerator = IdGenerator.shared();

    private RoleBuilder(ResourceId resourceId, RoleProperties properties) {
        this.resourceId = resourceId;
        this.properties = properties;
    }

    public static RoleBuilder create(String id, RoleProperties properties) {
        return create(ResourceId.of(id), properties);
    }

    public static RoleBuilder create(ResourceId id, RoleProperties properties) {
        return new RoleBuilder(id, properties);
    }

    /**
     * Prefix for the generated id; roles made on behalf of another resource use their own.
     */
    public RoleBuilder kind(String kind) {
        this.kind = kind;
        return this;
    }

    public RoleBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public Role build() {
        List<String> violations = new ArrayList<>();
        if (properties == null) {
            throw new ConfigurationException("role properties are required");
        }
        PolicyDocument trust = properties.getAssumeRolePolicyDocument();
        if (trust == null || trust.getStatements().isEmpty()) {
            violations.add("role requires an assume role policy document with at least one statement");
        } else if (trust.getStatements().stream().anyMatch(statement -> statement.getPrincipal() == null)) {
            violations.add("every assume role statement needs a principal");
        }
        for (Policy policy : properties.getPolicies()) {
            if (policy.getPolicyDocument().getStatements().isEmpty()) {
                violations.add("inline policy '" + policy.getPolicyName() + "' has no statements");
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
        return new Role(resourceId, idGenerator.generate(kind), properties);
    }
}
