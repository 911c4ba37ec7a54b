package com.phillippitts.bilingualtts.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for text segmentation. Read-only after startup and shared by all requests.
 */
@Validated
@ConfigurationProperties(prefix = "tts.segmentation")
public class SegmentationProperties {

    /** Length (UTF-16 code units) at which a running segment is closed. */
    @Positive
    private final int maxSegmentLength;

    /**
     * Minimum trimmed length for English segments. Purely numeric segments are exempt,
     * Chinese segments use a minimum of one character.
     */
    @Min(1)
    private final int minSegmentLength;

    /**
     * Characters inspected before and from a number's start for CJK ideographs when deciding
     * whether an embedded number is voiced in Chinese. The window size is a heuristic kept
     * configurable on purpose.
     */
    @Min(0)
    private final int numericContextWindow;

    /** Upper bound for a top-level chunk before line splitting. */
    @Positive
    private final int maxChunkLength;

    @ConstructorBinding
    public SegmentationProperties(Integer maxSegmentLength,
                                  Integer minSegmentLength,
                                  Integer numericContextWindow,
                                  Integer maxChunkLength) {
        this.maxSegmentLength = maxSegmentLength == null ? 1000 : maxSegmentLength;
        this.minSegmentLength = minSegmentLength == null ? 2 : minSegmentLength;
        this.numericContextWindow = numericContextWindow == null ? 5 : numericContextWindow;
        this.maxChunkLength = maxChunkLength == null ? 5000 : maxChunkLength;
    }

    /**
     * Properties with every value at its default (1000 / 2 / 5 / 5000).
     */
    public static SegmentationProperties defaults() {
        return new SegmentationProperties(null, null, null, null);
    }

    public int getMaxSegmentLength() {
        return maxSegmentLength;
    }

    public int getMinSegmentLength() {
        return minSegmentLength;
    }

    public int getNumericContextWindow() {
        return numericContextWindow;
    }

    public int getMaxChunkLength() {
        return maxChunkLength;
    }
}
