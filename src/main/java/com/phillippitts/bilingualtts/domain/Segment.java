package com.phillippitts.bilingualtts.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable synthesis unit: a piece of text with a single resolved language.
 *
 * <p>The index tuple {@code (chunkIndex, lineIndex, segmentIndex)} is unique within one
 * request and defines the reading order. {@link #ORDER} is the only ordering the assembler
 * may rely on; dispatch and completion order carry no meaning.
 *
 * @param text         segment text, non-blank
 * @param language     resolved language (selects the voice)
 * @param chunkIndex   top-level chunk index
 * @param lineIndex    line index inside the chunk
 * @param segmentIndex zero-based emission index inside the line
 */
public record Segment(
        String text,
        LanguageTag language,
        int chunkIndex,
        int lineIndex,
        int segmentIndex
) {

    /** Reading order: chunk, then line, then segment, ascending. */
    public static final Comparator<Segment> ORDER = Comparator
            .comparingInt(Segment::chunkIndex)
            .thenComparingInt(Segment::lineIndex)
            .thenComparingInt(Segment::segmentIndex);

    /**
     * @throws NullPointerException     if text or language is null
     * @throws IllegalArgumentException if text is blank or an index is negative
     */
    public Segment {
        Objects.requireNonNull(text, "Segment text must not be null");
        Objects.requireNonNull(language, "Segment language must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Segment text must not be blank");
        }
        if (chunkIndex < 0 || lineIndex < 0 || segmentIndex < 0) {
            throw new IllegalArgumentException("Segment indices must be non-negative");
        }
    }

    /**
     * Stable textual key of the index tuple, e.g. {@code 0_3_1}.
     * Used for artifact file names and log lines.
     */
    public String key() {
        return chunkIndex + "_" + lineIndex + "_" + segmentIndex;
    }
}
