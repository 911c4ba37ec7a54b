package com.phillippitts.bilingualtts.service.pipeline;

import com.phillippitts.bilingualtts.domain.AudioArtifact;
import com.phillippitts.bilingualtts.domain.PipelineResult;
import com.phillippitts.bilingualtts.exception.AssemblyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Concatenates segment audio files byte for byte, in the order given.
 *
 * <p>No re-encoding and no silence is inserted. This relies on MP3 being a sequence of
 * self-contained frames, so joined files play back as one stream; other encodings may need a real
 * muxer. Callers must pass artifacts already sorted by {@link com.phillippitts.bilingualtts.domain.Segment#ORDER}.
 */
@Component
public class AudioAssembler {

    private static final Logger LOG = LogManager.getLogger(AudioAssembler.class);

    public PipelineResult assemble(List<AudioArtifact> orderedArtifacts) {
        if (orderedArtifacts == null || orderedArtifacts.isEmpty()) {
            throw new AssemblyException("No audio artifacts to assemble");
        }
        long expected = 0;
        for (AudioArtifact artifact : orderedArtifacts) {
            expected += artifact.sizeBytes();
        }
        if (expected > Integer.MAX_VALUE - 8) {
            throw new AssemblyException("Combined audio too large: " + expected + " bytes");
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream((int) expected);
        for (AudioArtifact artifact : orderedArtifacts) {
            try {
                long copied = Files.copy(artifact.file(), out);
                if (copied != artifact.sizeBytes()) {
                    throw new AssemblyException("Artifact " + artifact.segment().key() + " changed size: expected "
                            + artifact.sizeBytes() + " bytes, read " + copied);
                }
            } catch (IOException e) {
                throw new AssemblyException("Failed to read artifact " + artifact.segment().key(), e);
            }
        }
        LOG.debug("Assembled {} artifacts into {} bytes", orderedArtifacts.size(), out.size());
        return new PipelineResult(out.toByteArray(), orderedArtifacts.size());
    }
}
