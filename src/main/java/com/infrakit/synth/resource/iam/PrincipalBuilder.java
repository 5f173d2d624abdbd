package com.infrakit.synth.resource.iam;

import com.infrakit.synth.model.ConfigurationException;

/**
 * Two-step principal construction: pick the kind, then build. A principal without a
 * kind cannot be built.
 */
public class PrincipalBuilder {

    private PrincipalBuilder() {
    }

    public static PrincipalBuilder create() {
        return new PrincipalBuilder();
    }

    public Chosen service(String service) {
        return new Chosen(Principal.Kind.SERVICE, service);
    }

    public Chosen aws(String accountOrArn) {
        return new Chosen(Principal.Kind.AWS, accountOrArn);
    }

    public Chosen literal(String literal) {
        return new Chosen(Principal.Kind.LITERAL, literal);
    }

    public static final class Chosen {

        private final Principal.Kind kind;
        private final String value;

        private Chosen(Principal.Kind kind, String value) {
            this.kind = kind;
            this.value = value;
        }

        public Principal build() {
            if (value == null || value.isBlank()) {
                throw new ConfigurationException(kind.name().toLowerCase() + " principal must not be blank");
            }
            if (kind == Principal.Kind.SERVICE && !value.endsWith(".amazonaws.com")) {
                throw new ConfigurationException("service principal must end with .amazonaws.com: " + value);
            }
            return new Principal(kind, value);
        }
    }
}
