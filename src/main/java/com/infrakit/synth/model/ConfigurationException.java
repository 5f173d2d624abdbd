package com.infrakit.synth.model;

import java.util.List;

/**
 * Raised by a resource builder when its own fields form an illegal combination.
 * Holds every violated rule so the caller can fix them in one pass.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> violations;

    public ConfigurationException(String violation) {
        this(List.of(violation));
    }

    public ConfigurationException(List<String> violations) {
        super(String.join(System.lineSeparator(), violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
