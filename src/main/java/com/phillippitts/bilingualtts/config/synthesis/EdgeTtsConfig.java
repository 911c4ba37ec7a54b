package com.phillippitts.bilingualtts.config.synthesis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the edge-tts synthesis backend.
 * Binds to properties prefixed with "tts.edge".
 *
 * <p>Example application.properties:
 * <pre>
 * tts.edge.binary-path=edge-tts
 * tts.edge.timeout-seconds=30
 * tts.edge.max-stderr-bytes=8192
 * </pre>
 *
 * @param binaryPath     edge-tts executable, either a bare command resolved on PATH or a path
 * @param timeoutSeconds hard limit for one edge-tts process (seconds)
 * @param maxStderrBytes maximum stderr captured for diagnostics
 */
@ConfigurationProperties(prefix = "tts.edge")
@Validated
public record EdgeTtsConfig(
        @NotBlank(message = "edge-tts binary path must not be blank")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes
) {

    public static final String DEFAULT_BINARY = "edge-tts";

    @ConstructorBinding
    public EdgeTtsConfig {
        binaryPath = (binaryPath == null || binaryPath.isBlank()) ? DEFAULT_BINARY : binaryPath;
        timeoutSeconds = timeoutSeconds <= 0 ? 30 : timeoutSeconds;
        maxStderrBytes = maxStderrBytes <= 0 ? 8192 : maxStderrBytes;
    }

    /**
     * Standard values: {@code edge-tts} on PATH, 30 s timeout, 8 KB stderr cap.
     */
    public static EdgeTtsConfig defaults() {
        return new EdgeTtsConfig(DEFAULT_BINARY, 30, 8192);
    }
}
