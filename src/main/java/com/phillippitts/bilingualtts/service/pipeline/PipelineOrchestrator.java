package com.phillippitts.bilingualtts.service.pipeline;

import com.phillippitts.bilingualtts.domain.PipelineResult;
import com.phillippitts.bilingualtts.domain.VoiceProfile;

/**
 * Turns raw text into one audio stream: segmentation, bounded concurrent synthesis, ordered assembly.
 *
 * <p>The result's segment order always equals segmentation order, whatever order the syntheses
 * finish in. No partial audio is returned under the default fail-fast policy.
 */
public interface PipelineOrchestrator {

    /**
     * Runs the whole pipeline for {@code text}.
     *
     * @param text raw input, may contain several lines
     * @param voiceProfile voices to use per language
     * @param maxConcurrency maximum number of segment syntheses in flight, at least 1
     * @return concatenated audio
     * @throws com.phillippitts.bilingualtts.exception.NoSegmentsException if the text yields nothing to speak
     * @throws com.phillippitts.bilingualtts.exception.SynthesisException if a segment fails
     *         (fail-fast) or every segment fails (best-effort)
     * @throws com.phillippitts.bilingualtts.exception.AssemblyException if concatenation fails
     */
    PipelineResult run(String text, VoiceProfile voiceProfile, int maxConcurrency);
}
