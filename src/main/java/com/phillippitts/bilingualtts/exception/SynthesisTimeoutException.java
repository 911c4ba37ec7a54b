package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when the synthesis backend does not produce audio within the configured timeout.
 */
public class SynthesisTimeoutException extends SynthesisException {

    private final long timeoutMs;

    public SynthesisTimeoutException(String message, String voice, long timeoutMs) {
        super(message, voice);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
