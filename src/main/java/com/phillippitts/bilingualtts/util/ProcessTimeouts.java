package com.phillippitts.bilingualtts.util;

import java.time.Duration;

/**
 * Standard timeout values for external process and stream-reader thread management.
 *
 * <p>Used by {@link com.phillippitts.bilingualtts.service.synthesis.edge.EdgeTtsProcessRunner}
 * when driving the edge-tts subprocess.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time allowed for stream reader threads to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Time allowed for stream reader threads during cleanup. Readers are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after {@link Process#destroy()} before escalating to a forcible kill.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
