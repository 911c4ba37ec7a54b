package com.phillippitts.bilingualtts.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Encoded audio produced for one segment, stored as a file in the run's workspace.
 *
 * <p>A zero-size artifact cannot be constructed: empty backend output is a synthesis
 * failure, not a valid empty result.
 *
 * @param segment   the segment this audio voices
 * @param file      workspace file holding the encoded bytes
 * @param sizeBytes size of {@code file} in bytes, strictly positive
 */
public record AudioArtifact(Segment segment, Path file, long sizeBytes) {

    public AudioArtifact {
        Objects.requireNonNull(segment, "segment must not be null");
        Objects.requireNonNull(file, "file must not be null");
        if (sizeBytes <= 0) {
            throw new IllegalArgumentException(
                    "Artifact size must be positive, got " + sizeBytes + " for segment " + segment.key());
        }
    }
}
