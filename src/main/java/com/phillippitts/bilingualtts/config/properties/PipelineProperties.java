package com.phillippitts.bilingualtts.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the synthesis pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "tts.pipeline")
public class PipelineProperties {

    /**
     * What a single failed segment does to the run.
     *
     * <ul>
     *   <li>{@link #FAIL_FAST}: abort the run and propagate the first error (default)</li>
     *   <li>{@link #BEST_EFFORT}: skip failed segments, succeed if at least one artifact exists</li>
     * </ul>
     */
    public enum FailurePolicy { FAIL_FAST, BEST_EFFORT }

    /** Maximum in-flight synthesis calls per run. */
    @Positive
    private final int maxConcurrency;

    /** Per-segment synthesis timeout in seconds. */
    @Positive
    private final int synthesisTimeoutSeconds;

    @NotNull
    private final FailurePolicy failurePolicy;

    @ConstructorBinding
    public PipelineProperties(Integer maxConcurrency,
                              Integer synthesisTimeoutSeconds,
                              FailurePolicy failurePolicy) {
        this.maxConcurrency = maxConcurrency == null ? 4 : maxConcurrency;
        this.synthesisTimeoutSeconds = synthesisTimeoutSeconds == null ? 30 : synthesisTimeoutSeconds;
        this.failurePolicy = failurePolicy == null ? FailurePolicy.FAIL_FAST : failurePolicy;
    }

    /**
     * Convenience constructor for tests (fail-fast policy).
     */
    public PipelineProperties(int maxConcurrency, int synthesisTimeoutSeconds) {
        this(maxConcurrency, synthesisTimeoutSeconds, FailurePolicy.FAIL_FAST);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getSynthesisTimeoutSeconds() {
        return synthesisTimeoutSeconds;
    }

    public Duration getSynthesisTimeout() {
        return Duration.ofSeconds(synthesisTimeoutSeconds);
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }
}
