package com.infrakit.synth.stack;

/**
 * Two registrations share an identifier that must be unique within a template.
 */
public class DuplicateIdentifierException extends IntegrityException {

    private static final long serialVersionUID = 1L;

    public enum IdentifierKind {
        RESOURCE_ID,
        SYNTHESIZED_ID
    }

    private final IdentifierKind identifierKind;
    private final String identifier;

    public DuplicateIdentifierException(IdentifierKind identifierKind, String identifier) {
        super("%s '%s' is registered more than once".formatted(
                identifierKind == IdentifierKind.RESOURCE_ID ? "Resource id" : "Synthesized id", identifier));
        this.identifierKind = identifierKind;
        this.identifier = identifier;
    }

    public IdentifierKind getIdentifierKind() {
        return identifierKind;
    }

    public String getIdentifier() {
        return identifier;
    }
}
