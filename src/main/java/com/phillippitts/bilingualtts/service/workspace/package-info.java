/**
 * Per-run scratch directories for segment audio. A run opens one
 * {@link com.phillippitts.bilingualtts.service.workspace.Workspace} and releases it on every exit path.
 */
package com.phillippitts.bilingualtts.service.workspace;
