package com.phillippitts.bilingualtts.service;

import com.phillippitts.bilingualtts.config.properties.PipelineProperties;
import com.phillippitts.bilingualtts.domain.PipelineResult;
import com.phillippitts.bilingualtts.domain.VoiceProfile;
import com.phillippitts.bilingualtts.exception.InvalidInputException;
import com.phillippitts.bilingualtts.service.pipeline.PipelineOrchestrator;
import com.phillippitts.bilingualtts.service.voice.VoiceCatalog;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Validates a request, resolves its voice profile and runs the pipeline with the configured
 * concurrency.
 */
@Service
public class DefaultSpeechSynthesisService implements SpeechSynthesisService {

    private final PipelineOrchestrator orchestrator;
    private final VoiceCatalog voiceCatalog;
    private final PipelineProperties pipelineProperties;

    public DefaultSpeechSynthesisService(PipelineOrchestrator orchestrator,
                                         VoiceCatalog voiceCatalog,
                                         PipelineProperties pipelineProperties) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.voiceCatalog = Objects.requireNonNull(voiceCatalog, "voiceCatalog");
        this.pipelineProperties = Objects.requireNonNull(pipelineProperties, "pipelineProperties");
    }

    @Override
    public PipelineResult synthesize(String text, String voiceGender) {
        if (text == null) {
            throw new InvalidInputException("no text provided");
        }
        if (text.isBlank()) {
            throw new InvalidInputException("empty text provided");
        }
        VoiceProfile profile = voiceCatalog.profileFor(voiceGender);
        return orchestrator.run(text, profile, pipelineProperties.getMaxConcurrency());
    }
}
