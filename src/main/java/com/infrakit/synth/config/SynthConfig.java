package com.infrakit.synth.config;

import java.time.Duration;

import lombok.Builder;
import lombok.Data;

/**
 * Runtime settings shared by serialization and the deployment collaborators.
 *
 * Defaults:
 * - status polled every 10 seconds, at most 360 times
 * - 4 concurrent asset uploads
 * - pretty printed template bodies
 * - generated log groups retain events for 731 days
 */
@Data
@Builder
public class SynthConfig {

    /**
     * Fixed delay between two deployment status polls.
     */
    @Builder.Default
    private Duration pollInterval = Duration.ofSeconds(10);

    /**
     * Polls before a deployment is given up as stuck.
     */
    @Builder.Default
    private int maxPollAttempts = 360;

    /**
     * Upper bound on concurrent asset uploads.
     */
    @Builder.Default
    private int uploadParallelism = 4;

    /**
     * Whether serialized template bodies are indented.
     */
    @Builder.Default
    private boolean prettyPrint = true;

    /**
     * Retention applied to log groups generated for functions.
     */
    @Builder.Default
    private int defaultLogRetentionDays = 731;

    /**
     * Bucket that function archives are uploaded to when a builder names none.
     */
    private String assetBucket;

    public static SynthConfig defaults() {
        return SynthConfig.builder().build();
    }
}
