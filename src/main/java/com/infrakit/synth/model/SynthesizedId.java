package com.infrakit.synth.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Generated wire-level key of a resource inside one template.
 */
@Value
public class SynthesizedId {

    /**
     * Width of the zero-padded suffix {@link IdGenerator} appends, enough for any unsigned 32-bit value.
     */
    public static final int SUFFIX_WIDTH = 10;

    @NonNull
    String value;

    public static SynthesizedId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("synthesized id must not be blank");
        }
        return new SynthesizedId(value);
    }

    /**
     * The kind prefix of this id, e.g. {@code Role} for {@code Role2831993812} and
     * {@code Route53} for {@code Route530000004711}. Ids not shaped like generated ones
     * lose every trailing digit.
     */
    public String kindHint() {
        int length = value.length();
        if (length > SUFFIX_WIDTH && allDigits(length - SUFFIX_WIDTH)) {
            return value.substring(0, length - SUFFIX_WIDTH);
        }
        int end = length;
        while (end > 0 && Character.isDigit(value.charAt(end - 1))) {
            end--;
        }
        return end == 0 ? value : value.substring(0, end);
    }

    private boolean allDigits(int from) {
        for (int i = from; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return value;
    }
}
