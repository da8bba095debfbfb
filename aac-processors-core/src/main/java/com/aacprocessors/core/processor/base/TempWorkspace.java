package com.aacprocessors.core.processor.base;

import com.aacprocessors.core.config.ProcessorConfig.WorkspaceConfig;
import com.aacprocessors.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Scratch directory for one processor call, deleted when closed.
 *
 * <p>Always acquire inside try-with-resources:
 * <pre>{@code
 * try (TempWorkspace workspace = openWorkspace()) {
 *     Path store = workspace.resolve("store.db");
 *     ...
 * }
 * }</pre>
 *
 * <p>If deletion fails the directory stays registered with its owning processor and can be
 * reclaimed later through {@code cleanupTempFiles()}.
 */
public final class TempWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TempWorkspace.class);

    private final Path directory;
    private final Consumer<TempWorkspace> onRelease;
    private boolean released;

    private TempWorkspace(Path directory, Consumer<TempWorkspace> onRelease) {
        this.directory = directory;
        this.onRelease = onRelease;
    }

    /**
     * Creates a new scratch directory.
     *
     * @param config workspace settings
     * @param onRelease called once the directory has been deleted
     * @return open workspace
     * @throws IOException if the directory cannot be created
     */
    public static TempWorkspace create(WorkspaceConfig config, Consumer<TempWorkspace> onRelease) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Path directory = config.directory() == null
            ? Files.createTempDirectory(config.prefix())
            : Files.createTempDirectory(Files.createDirectories(Path.of(config.directory())), config.prefix());
        log.debug("Created scratch directory {}", directory);
        return new TempWorkspace(directory, onRelease == null ? workspace -> { } : onRelease);
    }

    public Path directory() {
        return directory;
    }

    /**
     * Resolves a path inside the workspace, creating parent directories.
     *
     * @param relativePath path relative to the workspace
     * @return resolved path
     * @throws IOException if parent directories cannot be created
     */
    public Path resolve(String relativePath) throws IOException {
        Path path = directory.resolve(relativePath).normalize();
        if (!path.startsWith(directory)) {
            throw new IOException("Path escapes scratch directory: " + relativePath);
        }
        Files.createDirectories(path.getParent());
        return path;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Deletes the scratch directory. Safe to call more than once.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        try {
            FileUtils.deleteRecursively(directory);
            released = true;
            log.debug("Deleted scratch directory {}", directory);
            onRelease.accept(this);
        } catch (IOException e) {
            log.warn("Could not delete scratch directory {}: {}", directory, e.getMessage());
        }
    }
}
