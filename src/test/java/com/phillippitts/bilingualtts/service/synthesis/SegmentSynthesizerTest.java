package com.phillippitts.bilingualtts.service.synthesis;

import com.phillippitts.bilingualtts.config.ThreadPoolConfig;
import com.phillippitts.bilingualtts.config.properties.ThreadPoolProperties;
import com.phillippitts.bilingualtts.config.properties.WorkspaceProperties;
import com.phillippitts.bilingualtts.domain.AudioArtifact;
import com.phillippitts.bilingualtts.domain.LanguageTag;
import com.phillippitts.bilingualtts.domain.Segment;
import com.phillippitts.bilingualtts.domain.VoiceProfile;
import com.phillippitts.bilingualtts.exception.EmptySynthesisException;
import com.phillippitts.bilingualtts.exception.SynthesisBackendException;
import com.phillippitts.bilingualtts.exception.SynthesisTimeoutException;
import com.phillippitts.bilingualtts.service.metrics.SynthesisMetrics;
import com.phillippitts.bilingualtts.service.workspace.TempDirectoryWorkspaceManager;
import com.phillippitts.bilingualtts.service.workspace.Workspace;
import com.phillippitts.bilingualtts.testutil.FakeSynthesisClient;
import com.phillippitts.bilingualtts.util.TimeUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SegmentSynthesizerTest {

    private static final VoiceProfile MALE =
            new VoiceProfile("male", "en-US-ChristopherNeural", "zh-CN-YunxiNeural");
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @TempDir
    Path tempDir;

    private FakeSynthesisClient client;
    private SimpleMeterRegistry registry;
    private SegmentSynthesizer synthesizer;
    private Workspace workspace;

    @BeforeEach
    void setUp() {
        client = new FakeSynthesisClient();
        registry = new SimpleMeterRegistry();
        synthesizer = newSynthesizer(client);
        WorkspaceProperties props = new WorkspaceProperties();
        props.setBaseDir(tempDir.toString());
        workspace = new TempDirectoryWorkspaceManager(props).newScope();
    }

    @AfterEach
    void tearDown() {
        workspace.close();
    }

    private SegmentSynthesizer newSynthesizer(SynthesisClient backend) {
        return new SegmentSynthesizer(backend, new SimpleAsyncTaskExecutor("test-synth-"),
                new SynthesisMetrics(registry));
    }

    @Test
    void writesAudioWithVoiceForSegmentLanguage() throws IOException {
        Segment segment = new Segment("你好。", LanguageTag.ZH, 0, 1, 2);

        AudioArtifact artifact = synthesizer.synthesize(segment, MALE, workspace, TIMEOUT);

        byte[] expected = FakeSynthesisClient.audioFor("你好。", "zh-CN-YunxiNeural");
        assertThat(artifact.segment()).isEqualTo(segment);
        assertThat(artifact.sizeBytes()).isEqualTo(expected.length);
        assertThat(artifact.file().getFileName().toString())
                .isEqualTo("segment_0_1_2_" + workspace.sessionId() + ".mp3");
        assertThat(Files.readAllBytes(artifact.file())).isEqualTo(expected);
        assertThat(registry.get("tts.synthesis.segment.latency").tag("language", "zh").timer().count())
                .isEqualTo(1);
    }

    @Test
    void englishSegmentUsesEnglishVoice() {
        synthesizer.synthesize(new Segment("Hello", LanguageTag.EN, 0, 0, 0), MALE, workspace, TIMEOUT);

        assertThat(client.calls()).containsExactly(new FakeSynthesisClient.Call("Hello", "en-US-ChristopherNeural"));
    }

    @Test
    void emptyBackendOutputIsFailure() {
        client.emptyOn("Hello");
        Segment segment = new Segment("Hello", LanguageTag.EN, 0, 0, 0);

        assertThatThrownBy(() -> synthesizer.synthesize(segment, MALE, workspace, TIMEOUT))
                .isInstanceOf(EmptySynthesisException.class)
                .hasMessageContaining("0_0_0");
        assertThat(Files.exists(workspace.segmentFile(segment))).isFalse();
        assertThat(failures("empty")).isEqualTo(1.0);
    }

    @Test
    void backendSynthesisExceptionIsRethrownUnchanged() {
        client.failOn("Hello");

        assertThatThrownBy(() -> synthesizer.synthesize(
                new Segment("Hello", LanguageTag.EN, 0, 0, 0), MALE, workspace, TIMEOUT))
                .isInstanceOf(SynthesisBackendException.class)
                .hasMessageContaining("Scripted failure");
        assertThat(failures("backend")).isEqualTo(1.0);
    }

    @Test
    void unexpectedBackendErrorIsWrapped() {
        SynthesisClient broken = mock(SynthesisClient.class);
        IllegalStateException boom = new IllegalStateException("boom");
        when(broken.synthesize(anyString(), anyString())).thenThrow(boom);

        assertThatThrownBy(() -> newSynthesizer(broken).synthesize(
                new Segment("Hello", LanguageTag.EN, 3, 0, 1), MALE, workspace, TIMEOUT))
                .isInstanceOf(SynthesisBackendException.class)
                .hasMessageContaining("boom")
                .hasMessageContaining("segment=3_0_1")
                .hasCause(boom);
    }

    @Test
    void slowBackendTimesOutAndIsInterrupted() {
        client.delay("Hello", 5_000);

        assertThatThrownBy(() -> synthesizer.synthesize(
                new Segment("Hello", LanguageTag.EN, 0, 0, 0), MALE, workspace, Duration.ofMillis(100)))
                .isInstanceOf(SynthesisTimeoutException.class)
                .hasMessageContaining("timeoutMs=100");
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> client.interruptedCalls() == 1);
        assertThat(failures("timeout")).isEqualTo(1.0);
    }

    @Test
    void existingTargetFileIsNotOverwritten() throws IOException {
        Segment segment = new Segment("Hello", LanguageTag.EN, 0, 0, 0);
        Files.writeString(workspace.segmentFile(segment), "stale");

        assertThatThrownBy(() -> synthesizer.synthesize(segment, MALE, workspace, TIMEOUT))
                .isInstanceOf(SynthesisBackendException.class)
                .hasMessageContaining("Failed to store segment audio");
        assertThat(Files.readString(workspace.segmentFile(segment))).isEqualTo("stale");
    }

    @Test
    void saturatedSynthesisPoolRejectsInsteadOfRunningOnCallerThread() {
        ThreadPoolTaskExecutor pool = configuredPool(0);
        CountDownLatch hold = new CountDownLatch(1);
        try {
            pool.execute(() -> awaitQuietly(hold));
            client.delay("Hello", 3_000);
            SegmentSynthesizer pooled = new SegmentSynthesizer(client, pool, new SynthesisMetrics(registry));
            long start = System.nanoTime();

            assertThatThrownBy(() -> pooled.synthesize(
                    new Segment("Hello", LanguageTag.EN, 0, 0, 0), MALE, workspace, Duration.ofMillis(200)))
                    .isInstanceOf(SynthesisBackendException.class)
                    .hasMessageContaining("saturated");
            assertThat(TimeUtils.elapsedMillis(start)).isLessThan(1_000);
            assertThat(client.calls()).isEmpty();
            assertThat(failures("backend")).isEqualTo(1.0);
        } finally {
            hold.countDown();
            pool.shutdown();
        }
    }

    @Test
    void callQueuedBehindBusyPoolStillTimesOut() {
        ThreadPoolTaskExecutor pool = configuredPool(1);
        CountDownLatch hold = new CountDownLatch(1);
        try {
            pool.execute(() -> awaitQuietly(hold));
            SegmentSynthesizer pooled = new SegmentSynthesizer(client, pool, new SynthesisMetrics(registry));
            long start = System.nanoTime();

            assertThatThrownBy(() -> pooled.synthesize(
                    new Segment("Hello", LanguageTag.EN, 0, 0, 0), MALE, workspace, Duration.ofMillis(200)))
                    .isInstanceOf(SynthesisTimeoutException.class)
                    .hasMessageContaining("timeoutMs=200");
            assertThat(TimeUtils.elapsedMillis(start)).isLessThan(1_000);
            assertThat(failures("timeout")).isEqualTo(1.0);
        } finally {
            hold.countDown();
            pool.shutdown();
        }
        // Cancelled while queued, so the backend is never reached.
        assertThat(client.calls()).isEmpty();
    }

    // Single-thread synthesis pool built the way the application builds it.
    private static ThreadPoolTaskExecutor configuredPool(int queueCapacity) {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setSynthesis(new ThreadPoolProperties.PoolProperties(1, 1, queueCapacity, "busy-synth-"));
        return (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).synthesisExecutor();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private double failures(String reason) {
        return registry.get("tts.synthesis.segment.failure").tag("reason", reason).counter().count();
    }
}
