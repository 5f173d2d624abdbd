package com.infrakit.synth.resource.dynamodb;

/**
 * Scalar type of a key attribute.
 */
public enum AttributeType {
    /** String */
    S,
    /** Number */
    N,
    /** Binary */
    B
}
