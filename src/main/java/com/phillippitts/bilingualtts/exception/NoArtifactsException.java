package com.phillippitts.bilingualtts.exception;

/**
 * Thrown under the best-effort failure policy when every dispatched segment failed,
 * leaving nothing to assemble.
 */
public class NoArtifactsException extends SynthesisException {

    private final int failedSegments;

    public NoArtifactsException(int failedSegments, Throwable lastFailure) {
        super("All " + failedSegments + " segment syntheses failed", lastFailure);
        this.failedSegments = failedSegments;
    }

    public int getFailedSegments() {
        return failedSegments;
    }
}
