package com.phillippitts.bilingualtts.service.synthesis.edge;

import com.phillippitts.bilingualtts.config.synthesis.EdgeTtsConfig;
import com.phillippitts.bilingualtts.service.synthesis.SynthesisClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link SynthesisClient} backed by the {@code edge-tts} command line tool.
 *
 * <p>Each call spawns one short-lived process through {@link EdgeTtsProcessRunner}; there is no
 * shared state between calls. Text is never logged at INFO level, only its length.
 *
 * @see EdgeTtsConfig
 */
@Component
public class EdgeTtsSynthesisClient implements SynthesisClient {

    private static final Logger LOG = LogManager.getLogger(EdgeTtsSynthesisClient.class);
    static final String CLIENT_NAME = "edge-tts";

    private final EdgeTtsConfig cfg;
    private final EdgeTtsProcessRunner runner;

    @Autowired
    public EdgeTtsSynthesisClient(EdgeTtsConfig cfg) {
        this(cfg, new EdgeTtsProcessRunner());
    }

    EdgeTtsSynthesisClient(EdgeTtsConfig cfg, EdgeTtsProcessRunner runner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public byte[] synthesize(String text, String voiceId) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be null or blank");
        }
        Objects.requireNonNull(voiceId, "voiceId");
        LOG.debug("Invoking edge-tts (voice={}, chars={})", voiceId, text.length());
        return runner.synthesize(text, voiceId, cfg);
    }

    @Override
    public String getClientName() {
        return CLIENT_NAME;
    }

    /**
     * Healthy when the configured binary is an executable file, or a bare command found on PATH.
     */
    @Override
    public boolean isHealthy() {
        return isExecutableAvailable(cfg.binaryPath(), System.getenv("PATH"));
    }

    static boolean isExecutableAvailable(String binary, String pathEnv) {
        if (binary.contains(File.separator) || binary.contains("/")) {
            return Files.isExecutable(Path.of(binary));
        }
        if (pathEnv == null || pathEnv.isBlank()) {
            return false;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, binary))) {
                return true;
            }
        }
        return false;
    }
}
