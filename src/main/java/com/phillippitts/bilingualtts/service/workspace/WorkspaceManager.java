package com.phillippitts.bilingualtts.service.workspace;

import com.phillippitts.bilingualtts.exception.WorkspaceException;

/**
 * Creates and removes per-run scratch directories.
 */
public interface WorkspaceManager {

    /**
     * Creates a fresh, empty workspace with a new session id.
     *
     * @throws WorkspaceException if no directory can be created
     */
    Workspace newScope();

    /**
     * Deletes the workspace directory and everything in it. Idempotent. Failures are logged,
     * never thrown, so a cleanup problem cannot mask the run's own outcome.
     */
    void release(Workspace workspace);
}
