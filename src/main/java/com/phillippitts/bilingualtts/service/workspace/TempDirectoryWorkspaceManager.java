package com.phillippitts.bilingualtts.service.workspace;

import com.phillippitts.bilingualtts.config.properties.WorkspaceProperties;
import com.phillippitts.bilingualtts.exception.WorkspaceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link WorkspaceManager} that places each run in its own temp directory.
 *
 * <p>Directories are created under {@code tts.workspace.base-dir} (default: {@code java.io.tmpdir})
 * with the configured prefix. If the temp-directory call fails, a directory named after the session
 * id is created under the same base as a fallback.
 */
@Component
public class TempDirectoryWorkspaceManager implements WorkspaceManager {

    private static final Logger LOG = LogManager.getLogger(TempDirectoryWorkspaceManager.class);

    private final Path baseDir;
    private final String prefix;

    public TempDirectoryWorkspaceManager(WorkspaceProperties properties) {
        Objects.requireNonNull(properties, "properties");
        String configured = properties.getBaseDir();
        this.baseDir = (configured == null || configured.isBlank())
                ? Path.of(System.getProperty("java.io.tmpdir"))
                : Path.of(configured);
        this.prefix = properties.getPrefix();
    }

    @Override
    public Workspace newScope() {
        String sessionId = UUID.randomUUID().toString();
        Path directory;
        try {
            Files.createDirectories(baseDir);
            directory = Files.createTempDirectory(baseDir, prefix);
        } catch (IOException e) {
            LOG.warn("Could not create temp workspace under {}: {}; falling back", baseDir, e.toString());
            directory = fallback(sessionId, e);
        }
        LOG.debug("Workspace created: {}", directory);
        return new Workspace(sessionId, directory, this);
    }

    private Path fallback(String sessionId, IOException primary) {
        Path directory = baseDir.resolve(prefix + sessionId);
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            e.addSuppressed(primary);
            throw new WorkspaceException("Unable to create workspace under " + baseDir, e);
        }
    }

    @Override
    public void release(Workspace workspace) {
        if (workspace == null || !workspace.markReleased()) {
            return;
        }
        Path directory = workspace.directory();
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Failed to list workspace {} for cleanup: {}", directory, e.toString());
            return;
        }
        int failures = 0;
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                failures++;
                LOG.warn("Failed to delete {}: {}", path, e.toString());
            }
        }
        if (failures == 0) {
            LOG.debug("Workspace released: {}", directory);
        }
    }
}
