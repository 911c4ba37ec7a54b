package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when synthesizing audio for a segment fails.
 * Subclasses distinguish timeout, backend error and empty backend output.
 */
public class SynthesisException extends BilingualTtsException {

    private final String voice;

    public SynthesisException(String message) {
        super(message);
        this.voice = "unknown";
    }

    public SynthesisException(String message, String voice) {
        super(message + " (voice: " + voice + ")");
        this.voice = voice;
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
        this.voice = "unknown";
    }

    public SynthesisException(String message, String voice, Throwable cause) {
        super(message + " (voice: " + voice + ")", cause);
        this.voice = voice;
    }

    public String getVoice() {
        return voice;
    }
}
