package com.phillippitts.bilingualtts.service.synthesis.edge;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for edge-tts process tests.
 * Provides fake Process implementations for hermetic testing without the real edge-tts binary.
 */
final class EdgeTtsTestDoubles {

    private EdgeTtsTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param media bytes written to the {@code --write-media} target on start (null writes nothing)
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    record ProcessBehavior(byte[] media, String stderr, int exitCode, long finishAfterMillis) {}

    /**
     * Stub ProcessFactory that writes the scripted media file and returns a pre-configured Process.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final TestProcess process;
        private final byte[] media;
        private volatile List<String> lastCommand;

        StubProcessFactory(ProcessBehavior behavior) {
            this.process = new TestProcess(behavior);
            this.media = behavior.media();
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            this.lastCommand = List.copyOf(command);
            if (media != null) {
                Files.write(mediaPath(), media);
            }
            return process;
        }

        TestProcess process() {
            return process;
        }

        List<String> lastCommand() {
            return lastCommand;
        }

        Path mediaPath() {
            int flag = lastCommand.indexOf(EdgeTtsProcessRunner.WRITE_MEDIA_FLAG);
            return Path.of(lastCommand.get(flag + 1));
        }
    }

    /**
     * Factory whose process can never be started.
     */
    static final class FailingProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            throw new IOException("No such file or directory");
        }
    }

    /**
     * Minimal fake Process that allows controlling stderr, exit code, and termination timing.
     */
    static final class TestProcess extends Process {
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        TestProcess(ProcessBehavior behavior) {
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                this.alive = false;
            }
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis < 0 || finishAfterMillis > ms) {
                Thread.sleep(ms);
                return !alive;
            }
            Thread.sleep(finishAfterMillis);
            this.alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
