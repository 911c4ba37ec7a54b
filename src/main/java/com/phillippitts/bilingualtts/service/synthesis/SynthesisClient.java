package com.phillippitts.bilingualtts.service.synthesis;

import com.phillippitts.bilingualtts.exception.SynthesisException;

/**
 * Contract for speech synthesis backends.
 *
 * <p>A backend turns one piece of text into encoded audio using a named voice. It may be slow,
 * so callers bound every call with a timeout; implementations must respond to thread interruption
 * by abandoning the call.
 *
 * <p>Thread Safety: implementations must support concurrent calls.
 */
public interface SynthesisClient {

    /**
     * Synthesizes {@code text} with the given voice.
     *
     * @param text text to speak, non-blank
     * @param voiceId backend voice identifier (for example {@code zh-CN-YunxiNeural})
     * @return encoded audio bytes; null or empty is treated by callers as a failure
     * @throws SynthesisException if the backend fails
     */
    byte[] synthesize(String text, String voiceId);

    /**
     * @return backend name for logging and monitoring
     */
    String getClientName();

    /**
     * @return true if the backend looks usable right now
     */
    boolean isHealthy();
}
