package com.phillippitts.bilingualtts.service.workspace;

import com.phillippitts.bilingualtts.domain.Segment;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scratch directory owned by one pipeline run.
 *
 * <p>File names embed the segment's index tuple and the run's session id, so concurrent writers
 * never collide. Closing the workspace releases it through its manager; repeated closes are no-ops.
 */
public final class Workspace implements AutoCloseable {

    private final String sessionId;
    private final Path directory;
    private final WorkspaceManager owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public Workspace(String sessionId, Path directory, WorkspaceManager owner) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String sessionId() {
        return sessionId;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Target file for a segment's audio: {@code segment_<chunk>_<line>_<segment>_<sessionId>.mp3}.
     */
    public Path segmentFile(Segment segment) {
        return directory.resolve("segment_" + segment.key() + "_" + sessionId + ".mp3");
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return true for the first caller only
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "Workspace{sessionId=" + sessionId + ", directory=" + directory + '}';
    }
}
