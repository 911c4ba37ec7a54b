package com.phillippitts.bilingualtts.service.pipeline;

import com.phillippitts.bilingualtts.config.properties.PipelineProperties;
import com.phillippitts.bilingualtts.config.properties.PipelineProperties.FailurePolicy;
import com.phillippitts.bilingualtts.domain.AudioArtifact;
import com.phillippitts.bilingualtts.domain.PipelineResult;
import com.phillippitts.bilingualtts.domain.Segment;
import com.phillippitts.bilingualtts.domain.TextSpan;
import com.phillippitts.bilingualtts.domain.VoiceProfile;
import com.phillippitts.bilingualtts.exception.NoArtifactsException;
import com.phillippitts.bilingualtts.exception.NoSegmentsException;
import com.phillippitts.bilingualtts.exception.SynthesisExceptionBuilder;
import com.phillippitts.bilingualtts.service.metrics.SynthesisMetrics;
import com.phillippitts.bilingualtts.service.synthesis.SegmentSynthesizer;
import com.phillippitts.bilingualtts.service.text.Segmenter;
import com.phillippitts.bilingualtts.service.text.TextChunker;
import com.phillippitts.bilingualtts.service.workspace.Workspace;
import com.phillippitts.bilingualtts.service.workspace.WorkspaceManager;
import com.phillippitts.bilingualtts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link PipelineOrchestrator}.
 *
 * <p><b>Thread Model:</b> the calling thread segments the text, then submits one task per segment
 * to {@code dispatchExecutor}. A per-run {@link Semaphore} with {@code maxConcurrency} permits gates
 * submission, so at most that many segments are in flight for this run no matter how large the
 * shared pool is. A permit is returned when its task finishes or is skipped, which also lets the
 * caller wait for every dispatched task to settle by reacquiring all permits.
 *
 * <p><b>Ordering:</b> results are collected in completion order and then sorted by
 * {@link Segment#ORDER} before assembly.
 *
 * <p><b>Failure Policy</b> ({@code tts.pipeline.failure-policy}):
 * <ul>
 *   <li>{@code FAIL_FAST} (default): the first failure stops submission, cancels every other task
 *       with interruption, waits for them to settle and is rethrown</li>
 *   <li>{@code BEST_EFFORT}: failed segments are logged and skipped; {@link NoArtifactsException}
 *       if none succeed</li>
 * </ul>
 *
 * <p>The workspace is released on every exit path, after all tasks have settled.
 */
@Service
public class DefaultPipelineOrchestrator implements PipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultPipelineOrchestrator.class);
    static final String SESSION_ID = "sessionId";

    private static final Comparator<AudioArtifact> READING_ORDER =
            Comparator.comparing(AudioArtifact::segment, Segment.ORDER);

    private final TextChunker chunker;
    private final Segmenter segmenter;
    private final SegmentSynthesizer synthesizer;
    private final AudioAssembler assembler;
    private final WorkspaceManager workspaceManager;
    private final Executor dispatchExecutor;
    private final PipelineProperties properties;
    private final SynthesisMetrics metrics;

    public DefaultPipelineOrchestrator(TextChunker chunker,
                                       Segmenter segmenter,
                                       SegmentSynthesizer synthesizer,
                                       AudioAssembler assembler,
                                       WorkspaceManager workspaceManager,
                                       @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                       PipelineProperties properties,
                                       SynthesisMetrics metrics) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.workspaceManager = Objects.requireNonNull(workspaceManager, "workspaceManager");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public PipelineResult run(String text, VoiceProfile voiceProfile, int maxConcurrency) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voiceProfile, "voiceProfile");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }

        long start = System.nanoTime();
        List<Segment> segments = segmentAll(text);
        if (segments.isEmpty()) {
            metrics.recordRun("no_segments", 0, System.nanoTime() - start);
            throw new NoSegmentsException(text.length());
        }

        Workspace workspace = workspaceManager.newScope();
        String previousSession = ThreadContext.get(SESSION_ID);
        ThreadContext.put(SESSION_ID, workspace.sessionId());
        try {
            LOG.info("Synthesizing {} segment(s) (voice={}, maxConcurrency={}, policy={})",
                    segments.size(), voiceProfile.gender(), maxConcurrency, properties.getFailurePolicy());
            List<AudioArtifact> artifacts = dispatch(segments, voiceProfile, workspace, maxConcurrency);
            List<AudioArtifact> ordered = new ArrayList<>(artifacts);
            ordered.sort(READING_ORDER);
            PipelineResult result = assembler.assemble(ordered);

            metrics.recordRun("success", segments.size(), System.nanoTime() - start);
            LOG.info("Synthesis finished: {} segment(s), {} bytes in {} ms",
                    result.segmentCount(), result.sizeBytes(), TimeUtils.elapsedMillis(start));
            return result;
        } catch (RuntimeException e) {
            metrics.recordRun(e.getClass().getSimpleName(), segments.size(), System.nanoTime() - start);
            throw e;
        } finally {
            workspaceManager.release(workspace);
            if (previousSession == null) {
                ThreadContext.remove(SESSION_ID);
            } else {
                ThreadContext.put(SESSION_ID, previousSession);
            }
        }
    }

    List<Segment> segmentAll(String text) {
        List<Segment> segments = new ArrayList<>();
        for (TextSpan span : chunker.spans(text)) {
            segments.addAll(segmenter.segment(span.text(), span.chunkIndex(), span.lineIndex()));
        }
        return segments;
    }

    private List<AudioArtifact> dispatch(List<Segment> segments, VoiceProfile voiceProfile, Workspace workspace,
                                         int maxConcurrency) {
        boolean failFast = properties.getFailurePolicy() == FailurePolicy.FAIL_FAST;
        Duration timeout = properties.getSynthesisTimeout();
        Semaphore permits = new Semaphore(maxConcurrency);
        AtomicBoolean aborted = new AtomicBoolean(false);
        BlockingQueue<SegmentTask> completed = new LinkedBlockingQueue<>();
        List<SegmentTask> tasks = new ArrayList<>(segments.size());

        try {
            for (Segment segment : segments) {
                permits.acquire();
                if (failFast && aborted.get()) {
                    permits.release();
                    break;
                }
                SegmentTask task = new SegmentTask(segment, completed, () -> {
                    try {
                        return synthesizer.synthesize(segment, voiceProfile, workspace, timeout);
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                });
                tasks.add(task);
                submit(task, permits);
            }
            return collect(tasks, completed, failFast);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SynthesisExceptionBuilder.create("Interrupted while dispatching segments")
                    .cause(e)
                    .build();
        } finally {
            // Reached with tasks outstanding only on failure: stop them and wait until none can still write.
            for (SegmentTask task : tasks) {
                task.cancel(true);
            }
            permits.acquireUninterruptibly(maxConcurrency);
            permits.release(maxConcurrency);
        }
    }

    private void submit(SegmentTask task, Semaphore permits) {
        try {
            dispatchExecutor.execute(() -> {
                try {
                    task.run();
                } finally {
                    permits.release();
                }
            });
        } catch (RuntimeException e) {
            permits.release();
            task.cancel(false);
            throw SynthesisExceptionBuilder.create("Segment dispatch rejected")
                    .segment(task.segment.key())
                    .cause(e)
                    .build();
        }
    }

    private List<AudioArtifact> collect(List<SegmentTask> tasks, BlockingQueue<SegmentTask> completed,
                                        boolean failFast) throws InterruptedException {
        List<AudioArtifact> artifacts = new ArrayList<>(tasks.size());
        int failures = 0;
        Throwable lastFailure = null;
        for (int i = 0; i < tasks.size(); i++) {
            SegmentTask task = completed.take();
            try {
                artifacts.add(task.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (failFast) {
                    LOG.warn("Segment {} failed, aborting run: {}", task.segment.key(), cause.getMessage());
                    throw asRuntime(cause, task.segment);
                }
                failures++;
                lastFailure = cause;
                LOG.warn("Segment {} failed, skipping: {}", task.segment.key(), cause.getMessage());
            }
        }
        if (artifacts.isEmpty()) {
            throw new NoArtifactsException(failures, lastFailure);
        }
        if (failures > 0) {
            LOG.warn("{} of {} segment(s) failed and were left out", failures, tasks.size());
        }
        return artifacts;
    }

    private static RuntimeException asRuntime(Throwable cause, Segment segment) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return SynthesisExceptionBuilder.create("Segment synthesis failed")
                .segment(segment.key())
                .cause(cause)
                .build();
    }

    /**
     * Segment task that queues itself on completion, so results can be taken as they finish.
     */
    private static final class SegmentTask extends FutureTask<AudioArtifact> {
        private final Segment segment;
        private final BlockingQueue<SegmentTask> completed;

        SegmentTask(Segment segment, BlockingQueue<SegmentTask> completed,
                    Callable<AudioArtifact> work) {
            super(work);
            this.segment = segment;
            this.completed = completed;
        }

        @Override
        protected void done() {
            completed.add(this);
        }
    }
}
