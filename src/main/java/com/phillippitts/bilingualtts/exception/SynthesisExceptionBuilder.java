package com.phillippitts.bilingualtts.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for synthesis failures carrying contextual information.
 *
 * <p>Keeps error messages consistent between the segment synthesizer and the process-backed
 * client.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Backend failure with process details
 * throw SynthesisExceptionBuilder.create("Non-zero exit: 1")
 *         .voice("zh-CN-YunxiNeural")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 *
 * // Timeout for a specific segment
 * throw SynthesisExceptionBuilder.create("Synthesis timed out")
 *         .voice(voiceId)
 *         .segment(segment.key())
 *         .buildTimeout(30_000);
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String voice;
    private String segmentKey;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    public SynthesisExceptionBuilder voice(String voice) {
        this.voice = voice;
        return this;
    }

    /**
     * Sets the segment key ({@code chunk_line_segment}) the failure belongs to.
     */
    public SynthesisExceptionBuilder segment(String segmentKey) {
        this.segmentKey = segmentKey;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the process exit code (for external process failures).
     */
    public SynthesisExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds a backend failure.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (segment={key}, exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (voice: {voice})
     * </pre>
     *
     * @return constructed SynthesisBackendException
     */
    public SynthesisBackendException build() {
        String detailedMessage = buildDetailedMessage();
        String v = voice != null ? voice : "unknown";
        if (cause != null) {
            return new SynthesisBackendException(detailedMessage, v, cause);
        }
        return new SynthesisBackendException(detailedMessage, v);
    }

    /**
     * Builds a timeout failure.
     *
     * @param timeoutMs the timeout that elapsed
     * @return constructed SynthesisTimeoutException
     */
    public SynthesisTimeoutException buildTimeout(long timeoutMs) {
        metadata("timeoutMs", timeoutMs);
        SynthesisTimeoutException ex = new SynthesisTimeoutException(
                buildDetailedMessage(), voice != null ? voice : "unknown", timeoutMs);
        if (cause != null) {
            ex.initCause(cause);
        }
        return ex;
    }

    private String buildDetailedMessage() {
        boolean hasDetails = segmentKey != null || exitCode != null || durationMs != null
                || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (segmentKey != null) {
            sb.append("segment=").append(segmentKey);
            first = false;
        }
        if (exitCode != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
