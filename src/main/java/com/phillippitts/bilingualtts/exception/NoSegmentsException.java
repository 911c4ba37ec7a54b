package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when segmentation of a whole request produced nothing worth synthesizing
 * (e.g. only whitespace or stray punctuation).
 */
public class NoSegmentsException extends BilingualTtsException {

    private final int inputLength;

    public NoSegmentsException(int inputLength) {
        super("Nothing to synthesize: segmentation produced no segments (input length "
                + inputLength + ")");
        this.inputLength = inputLength;
    }

    public int getInputLength() {
        return inputLength;
    }
}
