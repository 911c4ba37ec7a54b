package com.phillippitts.bilingualtts.service;

import com.phillippitts.bilingualtts.domain.PipelineResult;

/**
 * Entry point for turning mixed Chinese/English text into one audio stream.
 */
public interface SpeechSynthesisService {

    /**
     * @param text input text, must contain something other than whitespace
     * @param voiceGender voice selector; null or blank uses the configured default
     * @return concatenated audio in reading order
     * @throws com.phillippitts.bilingualtts.exception.InvalidInputException for blank text or an unknown voice
     */
    PipelineResult synthesize(String text, String voiceGender);
}
