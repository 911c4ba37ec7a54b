package com.phillippitts.bilingualtts.service.synthesis;

import com.phillippitts.bilingualtts.domain.AudioArtifact;
import com.phillippitts.bilingualtts.domain.Segment;
import com.phillippitts.bilingualtts.domain.VoiceProfile;
import com.phillippitts.bilingualtts.exception.EmptySynthesisException;
import com.phillippitts.bilingualtts.exception.InvalidInputException;
import com.phillippitts.bilingualtts.exception.SynthesisException;
import com.phillippitts.bilingualtts.exception.SynthesisExceptionBuilder;
import com.phillippitts.bilingualtts.exception.SynthesisTimeoutException;
import com.phillippitts.bilingualtts.service.metrics.SynthesisMetrics;
import com.phillippitts.bilingualtts.service.workspace.Workspace;
import com.phillippitts.bilingualtts.util.LogSanitizer;
import com.phillippitts.bilingualtts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Synthesizes one {@link Segment} into an audio file inside the run's {@link Workspace}.
 *
 * <p>The voice is picked from the caller's {@link VoiceProfile} by the segment's language. The
 * backend call runs on the {@code synthesisExecutor} so it can be bounded by a timeout; a call that
 * overruns is cancelled with interruption.
 *
 * <p>Failures:
 * <ul>
 *   <li>{@link InvalidInputException} - segment text is blank after trimming</li>
 *   <li>{@link SynthesisTimeoutException} - backend did not answer in time</li>
 *   <li>{@link EmptySynthesisException} - backend answered with no audio</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.SynthesisBackendException} - synthesis pool
 *       rejected the call, or anything else</li>
 * </ul>
 */
@Component
public class SegmentSynthesizer {

    private static final Logger LOG = LogManager.getLogger(SegmentSynthesizer.class);

    private final SynthesisClient client;
    private final AsyncTaskExecutor executor;
    private final SynthesisMetrics metrics;

    public SegmentSynthesizer(SynthesisClient client,
                              @Qualifier("synthesisExecutor") AsyncTaskExecutor executor,
                              SynthesisMetrics metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public AudioArtifact synthesize(Segment segment, VoiceProfile voiceProfile, Workspace workspace,
                                    Duration timeout) {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(voiceProfile, "voiceProfile");
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(timeout, "timeout");

        String language = segment.language().name().toLowerCase(Locale.ROOT);
        String text = segment.text().strip();
        if (text.isEmpty()) {
            metrics.incrementSegmentFailure(language, "invalid");
            throw new InvalidInputException("empty segment " + segment.key());
        }
        String voice = voiceProfile.voiceFor(segment.language());

        long start = System.nanoTime();
        try {
            byte[] audio = callWithTimeout(text, voice, segment, timeout);
            if (audio == null || audio.length == 0) {
                throw new EmptySynthesisException(
                        "Backend returned no audio for segment " + segment.key(), voice);
            }
            Path file = write(workspace.segmentFile(segment), audio, voice, segment);
            metrics.recordSegment(language, System.nanoTime() - start);
            LOG.debug("Segment {} synthesized: {} bytes in {} ms ({}, '{}')", segment.key(), audio.length,
                    TimeUtils.elapsedMillis(start), voice, LogSanitizer.preview(text));
            return new AudioArtifact(segment, file, audio.length);
        } catch (SynthesisException e) {
            metrics.incrementSegmentFailure(language, reason(e));
            throw e;
        }
    }

    private byte[] callWithTimeout(String text, String voice, Segment segment, Duration timeout) {
        long start = System.nanoTime();
        Future<byte[]> future;
        try {
            future = executor.submit(() -> client.synthesize(text, voice));
        } catch (TaskRejectedException e) {
            throw SynthesisExceptionBuilder.create("Synthesis pool saturated")
                    .voice(voice)
                    .segment(segment.key())
                    .cause(e)
                    .build();
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw SynthesisExceptionBuilder.create("Synthesis timed out")
                    .voice(voice)
                    .segment(segment.key())
                    .buildTimeout(timeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw SynthesisExceptionBuilder.create("Interrupted while waiting for synthesis")
                    .voice(voice)
                    .segment(segment.key())
                    .cause(e)
                    .build();
        } catch (CancellationException e) {
            throw SynthesisExceptionBuilder.create("Synthesis cancelled")
                    .voice(voice)
                    .segment(segment.key())
                    .cause(e)
                    .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SynthesisException se) {
                throw se;
            }
            throw SynthesisExceptionBuilder.create("Synthesis failed: " + cause.getMessage())
                    .voice(voice)
                    .segment(segment.key())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(cause)
                    .build();
        }
    }

    private static Path write(Path file, byte[] audio, String voice, Segment segment) {
        try {
            return Files.write(file, audio, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw SynthesisExceptionBuilder.create("Failed to store segment audio")
                    .voice(voice)
                    .segment(segment.key())
                    .metadata("file", file)
                    .cause(e)
                    .build();
        }
    }

    private static String reason(SynthesisException e) {
        if (e instanceof SynthesisTimeoutException) {
            return "timeout";
        }
        if (e instanceof EmptySynthesisException) {
            return "empty";
        }
        return "backend";
    }
}
