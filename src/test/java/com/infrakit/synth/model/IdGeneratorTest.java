package com.infrakit.synth.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class IdGeneratorTest {

    @Test
    void testGeneratedIdStartsWithKindAndEndsWithDigits() {
        IdGenerator generator = new IdGenerator(new Random(7));

        SynthesizedId id = generator.generate("Role");

        assertThat(id.getValue()).startsWith("Role");
        assertThat(id.getValue().substring("Role".length())).matches("\\d{10}");
        assertThat(id.kindHint()).isEqualTo("Role");
    }

    @Test
    void testSuffixIsUnsigned() {
        Random alwaysNegative = new Random() {
            @Override
            public int nextInt() {
                return -1;
            }
        };

        SynthesizedId id = new IdGenerator(alwaysNegative).generate("Queue");

        assertThat(id.getValue()).isEqualTo("Queue4294967295");
    }

    @Test
    void testSmallSuffixIsZeroPadded() {
        Random alwaysSeven = new Random() {
            @Override
            public int nextInt() {
                return 7;
            }
        };

        SynthesizedId id = new IdGenerator(alwaysSeven).generate("Route53");

        assertThat(id.getValue()).isEqualTo("Route530000000007");
        assertThat(id.kindHint()).isEqualTo("Route53");
    }

    @Test
    void testRepeatedCallsGiveDistinctIds() {
        IdGenerator generator = IdGenerator.shared();
        Set<SynthesizedId> ids = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            ids.add(generator.generate("DynamoDBTable"));
        }

        assertThat(ids).hasSize(1000);
    }

    @Test
    void testBlankKindIsRejected() {
        IdGenerator generator = IdGenerator.shared();

        assertThatThrownBy(() -> generator.generate(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
