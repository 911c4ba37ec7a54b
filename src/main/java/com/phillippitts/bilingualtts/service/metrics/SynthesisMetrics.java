package com.phillippitts.bilingualtts.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for speech synthesis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Per-segment synthesis latency by language</li>
 *   <li>Per-segment failures by reason (timeout, backend, empty)</li>
 *   <li>Whole-run latency, outcome and segment count</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SynthesisMetrics {

    private static final String METRIC_PREFIX = "tts.synthesis";

    private final MeterRegistry registry;

    public SynthesisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one successful segment synthesis.
     *
     * @param language segment language tag (en, zh)
     * @param durationNanos duration in nanoseconds
     */
    public void recordSegment(String language, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".segment.latency")
                .description("Time taken to synthesize one segment")
                .tag("language", language)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the segment failure counter.
     *
     * @param language segment language tag (en, zh)
     * @param reason failure reason (timeout, backend, empty, invalid)
     */
    public void incrementSegmentFailure(String language, String reason) {
        Counter.builder(METRIC_PREFIX + ".segment.failure")
                .description("Number of failed segment syntheses")
                .tag("language", language)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a finished pipeline run.
     *
     * @param outcome success or the failure type
     * @param segmentCount number of segments the run dispatched
     * @param durationNanos duration in nanoseconds
     */
    public void recordRun(String outcome, int segmentCount, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".run.latency")
                .description("Time taken for a whole text-to-audio run")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        DistributionSummary.builder(METRIC_PREFIX + ".run.segments")
                .description("Segments per run")
                .register(registry)
                .record(segmentCount);
    }
}
