package com.phillippitts.bilingualtts.service.synthesis.edge;

import com.phillippitts.bilingualtts.config.synthesis.EdgeTtsConfig;
import com.phillippitts.bilingualtts.exception.SynthesisException;
import com.phillippitts.bilingualtts.exception.SynthesisExceptionBuilder;
import com.phillippitts.bilingualtts.util.ProcessTimeouts;
import com.phillippitts.bilingualtts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external {@code edge-tts} CLI for one piece of text.
 *
 * <p>Responsibilities:
 * - Build a deterministic CLI from {@link EdgeTtsConfig}
 * - Start the process via {@link ProcessFactory}
 * - Drain stdout and stderr concurrently (stderr kept for diagnostics)
 * - Enforce a timeout and terminate runaway processes
 * - Read the produced media file and delete it afterwards
 *
 * <p>Every call owns its process, gobblers and media file, so one runner serves concurrent calls.
 * An interrupt while waiting terminates the process.
 */
final class EdgeTtsProcessRunner {

    private static final Logger LOG = LogManager.getLogger(EdgeTtsProcessRunner.class);

    static final String WRITE_MEDIA_FLAG = "--write-media";
    private static final int ERROR_SNIPPET_MAX_CHARS = 512;

    private final ProcessFactory processFactory;

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stderr
    ) {}

    EdgeTtsProcessRunner() {
        this(new DefaultProcessFactory());
    }

    EdgeTtsProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Synthesizes {@code text} and returns the bytes edge-tts wrote.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} --voice ${voice} --text ${text} --write-media ${tempFile}
     * </pre>
     *
     * @return media bytes, possibly empty if edge-tts produced an empty file
     * @throws SynthesisException on timeout, non-zero exit, I/O failure or interruption
     */
    byte[] synthesize(String text, String voice, EdgeTtsConfig cfg) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        Objects.requireNonNull(cfg, "cfg");

        long startTime = System.nanoTime();
        Path media = null;
        ProcessExecution exec = null;
        try {
            media = Files.createTempFile("edge-tts-", ".mp3");
            exec = start(buildCommand(cfg, text, voice, media), cfg);

            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw error("Timeout after " + cfg.timeoutSeconds() + "s", voice, cfg, -1, exec.stderr(),
                        startTime, null)
                        .buildTimeout(TimeUnit.SECONDS.toMillis(cfg.timeoutSeconds()));
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, voice, cfg, exitCode, exec.stderr(), startTime, null)
                        .build();
            }
            byte[] audio = Files.readAllBytes(media);
            LOG.debug("edge-tts produced {} bytes in {} ms (voice={})",
                    audio.length, TimeUtils.elapsedMillis(startTime), voice);
            return audio;
        } catch (IOException e) {
            throw error("I/O failure: " + e.getMessage(), voice, cfg, -1, null, startTime, e).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw error("Interrupted while waiting for edge-tts", voice, cfg, -1, null, startTime, e).build();
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
            deleteQuietly(media);
        }
    }

    List<String> buildCommand(EdgeTtsConfig cfg, String text, String voice, Path media) {
        List<String> cmd = new ArrayList<>();
        cmd.add(cfg.binaryPath());
        cmd.add("--voice");
        cmd.add(voice);
        cmd.add("--text");
        cmd.add(text);
        cmd.add(WRITE_MEDIA_FLAG);
        cmd.add(media.toAbsolutePath().toString());
        return cmd;
    }

    private ProcessExecution start(List<String> command, EdgeTtsConfig cfg) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, null);

        // Start gobblers before waiting to avoid a full pipe blocking the child
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "edge-tts-out", cfg.maxStderrBytes());
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "edge-tts-err", cfg.maxStderrBytes());
        return new ProcessExecution(process, outGobbler, errGobbler, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a bounded buffer. Once the cap is hit the stream is still drained so the
     * child never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxChars) {
                            if (!capReached) {
                                LOG.debug("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = Math.max(0, maxChars - sink.length());
                        sink.append(line, 0, Math.min(line.length(), available));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("edge-tts process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying edge-tts process");
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp media file {}: {}", file, e.toString());
        }
    }

    private static SynthesisExceptionBuilder error(String msg, String voice, EdgeTtsConfig cfg, int exitCode,
                                                   StringBuilder stderr, long startNano, Throwable cause) {
        SynthesisExceptionBuilder builder = SynthesisExceptionBuilder.create(msg)
                .voice(voice)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", cfg.binaryPath());
        if (stderr != null) {
            synchronized (stderr) {
                builder.metadata("stderr", stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length())));
            }
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder;
    }
}
