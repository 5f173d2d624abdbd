package com.infrakit.synth.serialization;

/**
 * A serialized template body could not be read back.
 */
public class TemplateParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public TemplateParseException(String message) {
        super(message);
    }

    public TemplateParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
