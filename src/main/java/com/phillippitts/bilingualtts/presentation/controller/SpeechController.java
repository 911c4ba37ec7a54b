package com.phillippitts.bilingualtts.presentation.controller;

import com.phillippitts.bilingualtts.domain.PipelineResult;
import com.phillippitts.bilingualtts.exception.InvalidInputException;
import com.phillippitts.bilingualtts.service.SpeechSynthesisService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code POST /tts}: JSON {@code {"text": "...", "voice": "male"}} in, {@code audio/mpeg} out.
 *
 * <p>Thin adapter; validation and all failure mapping happen in the service layer and
 * {@code GlobalExceptionHandler}.
 */
@RestController
class SpeechController {

    private static final Logger LOG = LogManager.getLogger(SpeechController.class);
    static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

    private final SpeechSynthesisService speechService;

    SpeechController(SpeechSynthesisService speechService) {
        this.speechService = speechService;
    }

    @PostMapping(path = "/tts", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<byte[]> synthesize(@RequestBody(required = false) SpeechRequest request) {
        if (request == null) {
            throw new InvalidInputException("no text provided");
        }
        LOG.info("Processing text with {} voice (chars={})",
                request.voice() == null ? "default" : request.voice(),
                request.text() == null ? 0 : request.text().length());
        PipelineResult result = speechService.synthesize(request.text(), request.voice());
        return ResponseEntity.ok()
                .contentType(AUDIO_MPEG)
                .contentLength(result.sizeBytes())
                .body(result.audio());
    }

    /**
     * Request body of {@code POST /tts}. {@code voice} is optional.
     */
    record SpeechRequest(String text, String voice) {
    }
}
