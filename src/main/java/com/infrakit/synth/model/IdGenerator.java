package com.infrakit.synth.model;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Produces synthesized ids: the resource kind followed by an unsigned 32-bit random
 * suffix, zero-padded to {@link SynthesizedId#SUFFIX_WIDTH} digits. Uniqueness is
 * probabilistic; the stack builder rejects collisions.
 */
public class IdGenerator {

    private static final IdGenerator SHARED = new IdGenerator(new SecureRandom());

    private final Random random;

    public IdGenerator(Random random) {
        this.random = random;
    }

    public static IdGenerator shared() {
        return SHARED;
    }

    public SynthesizedId generate(String kind) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        String suffix = Integer.toUnsignedString(random.nextInt());
        return SynthesizedId.of(kind + "0".repeat(SynthesizedId.SUFFIX_WIDTH - suffix.length()) + suffix);
    }
}
