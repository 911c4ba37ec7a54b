package com.phillippitts.bilingualtts.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisMetricsTest {

    private SimpleMeterRegistry registry;
    private SynthesisMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SynthesisMetrics(registry);
    }

    @Test
    void recordsSegmentLatencyPerLanguage() {
        metrics.recordSegment("en", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordSegment("en", TimeUnit.MILLISECONDS.toNanos(80));
        metrics.recordSegment("zh", TimeUnit.MILLISECONDS.toNanos(50));

        assertThat(registry.get("tts.synthesis.segment.latency").tag("language", "en").timer().count())
                .isEqualTo(2);
        assertThat(registry.get("tts.synthesis.segment.latency").tag("language", "en").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        assertThat(registry.get("tts.synthesis.segment.latency").tag("language", "zh").timer().count())
                .isEqualTo(1);
    }

    @Test
    void countsFailuresByReason() {
        metrics.incrementSegmentFailure("zh", "timeout");
        metrics.incrementSegmentFailure("zh", "timeout");
        metrics.incrementSegmentFailure("en", "empty");

        assertThat(registry.get("tts.synthesis.segment.failure")
                .tags("language", "zh", "reason", "timeout").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("tts.synthesis.segment.failure")
                .tags("language", "en", "reason", "empty").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsRunOutcomeAndSegmentCount() {
        metrics.recordRun("success", 3, TimeUnit.SECONDS.toNanos(1));
        metrics.recordRun("SynthesisTimeoutException", 5, TimeUnit.SECONDS.toNanos(2));

        assertThat(registry.get("tts.synthesis.run.latency").tag("outcome", "success").timer().count())
                .isEqualTo(1);
        assertThat(registry.get("tts.synthesis.run.segments").summary().totalAmount()).isEqualTo(8.0);
    }
}
