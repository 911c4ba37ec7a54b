package com.phillippitts.bilingualtts.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Final concatenated audio of one synthesis request.
 *
 * @param audio        concatenated encoded audio, copied in and out
 * @param segmentCount number of segment artifacts merged into {@code audio}
 */
public record PipelineResult(byte[] audio, int segmentCount) {

    public PipelineResult {
        Objects.requireNonNull(audio, "audio must not be null");
        if (segmentCount <= 0) {
            throw new IllegalArgumentException("segmentCount must be positive, got " + segmentCount);
        }
        audio = audio.clone();
    }

    @Override
    public byte[] audio() {
        return audio.clone();
    }

    public int sizeBytes() {
        return audio.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PipelineResult other)) {
            return false;
        }
        return segmentCount == other.segmentCount && Arrays.equals(audio, other.audio);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(audio) + segmentCount;
    }

    @Override
    public String toString() {
        return "PipelineResult[sizeBytes=" + audio.length + ", segmentCount=" + segmentCount + "]";
    }
}
