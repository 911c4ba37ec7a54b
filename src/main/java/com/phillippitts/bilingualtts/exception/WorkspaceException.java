package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when no scratch directory can be created for a run.
 * Cleanup failures are logged and never surface as this exception.
 */
public class WorkspaceException extends BilingualTtsException {

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
