package com.infrakit.synth.stack;

/**
 * A registered resource set cannot be closed into a template.
 */
public abstract class IntegrityException extends Exception {

    private static final long serialVersionUID = 1L;

    protected IntegrityException(String message) {
        super(message);
    }
}
