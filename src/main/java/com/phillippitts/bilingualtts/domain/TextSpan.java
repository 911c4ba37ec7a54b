package com.phillippitts.bilingualtts.domain;

import java.util.Objects;

/**
 * One line of input text together with its logical position in the request.
 *
 * @param text       trimmed line content (never null)
 * @param chunkIndex index of the top-level chunk the line belongs to
 * @param lineIndex  index of the line inside its chunk, counting blank lines
 */
public record TextSpan(String text, int chunkIndex, int lineIndex) {

    public TextSpan {
        Objects.requireNonNull(text, "text must not be null");
        if (chunkIndex < 0 || lineIndex < 0) {
            throw new IllegalArgumentException(
                    "Indices must be non-negative, got chunk=" + chunkIndex + ", line=" + lineIndex);
        }
    }
}
