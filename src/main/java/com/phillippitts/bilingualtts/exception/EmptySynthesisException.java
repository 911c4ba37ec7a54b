package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when the backend reports success but produced zero bytes of audio.
 * Treated exactly like a hard backend failure.
 */
public class EmptySynthesisException extends SynthesisException {

    public EmptySynthesisException(String message, String voice) {
        super(message, voice);
    }
}
