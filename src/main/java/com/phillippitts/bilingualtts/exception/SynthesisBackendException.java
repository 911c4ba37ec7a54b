package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when the synthesis backend itself fails (process crash, non-zero exit, I/O error).
 */
public class SynthesisBackendException extends SynthesisException {

    public SynthesisBackendException(String message, String voice) {
        super(message, voice);
    }

    public SynthesisBackendException(String message, String voice, Throwable cause) {
        super(message, voice, cause);
    }
}
