package com.foamcase.store;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Hands out exactly one {@link FileHandle} per canonical file path and one {@link FolderHandle} per canonical
 * directory path, so every holder of a path sees the same cached tree and snapshot list.
 *
 * <p>A path is canonicalized by expanding {@code ${NAME}} placeholders, resolving it against the base
 * directory and normalizing it. The registry is not thread-safe; one registry is meant to be owned by the
 * code driving a single case, and dropping the registry drops every handle it created.
 */
public final class FileRegistry {
    private static final Logger LOGGER = Logger.getLogger(FileRegistry.class.getName());

    private final StoreSettings settings;
    private final EnvironmentExpander expander;
    private final Map<Path, FileHandle> files = new HashMap<>();
    private final Map<Path, FolderHandle> folders = new HashMap<>();

    public FileRegistry() {
        this(StoreSettings.fromSystemProperties());
    }

    public FileRegistry(StoreSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.expander = new EnvironmentExpander(settings.getEnvironment());
    }

    public Path resolvePath(String rawPath) {
        return resolvePath(rawPath, settings.getBaseDirectory());
    }

    /** Canonical form of {@code rawPath}, with relative paths taken from {@code baseDirectory}. */
    public Path resolvePath(String rawPath, Path baseDirectory) {
        Objects.requireNonNull(rawPath, "rawPath");
        return canonical(baseDirectory.resolve(Paths.get(expander.expand(rawPath))));
    }

    /**
     * Returns the handle for {@code rawPath}, creating it on first use. A new handle for a live file picks up
     * the snapshots already lying next to it.
     *
     * @throws IOException if the containing folder cannot be listed
     */
    public FileHandle file(String rawPath) throws IOException {
        return file(resolvePath(rawPath));
    }

    public FileHandle file(Path path) throws IOException {
        Path key = canonical(path);
        FileHandle existing = files.get(key);
        if (existing != null) {
            return existing;
        }
        boolean snapshot = SnapshotNames.isSnapshot(fileName(key));
        FileHandle handle = new FileHandle(this, key, settings.isAutosave() && !snapshot, snapshot);
        files.put(key, handle);
        if (!snapshot) {
            try {
                handle.discoverSnapshots();
            } catch (IOException ex) {
                files.remove(key);
                throw ex;
            }
        }
        LOGGER.fine(() -> "Registered " + handle);
        return handle;
    }

    public FolderHandle folder(String rawPath) {
        return folder(resolvePath(rawPath));
    }

    public FolderHandle folder(Path path) {
        return folders.computeIfAbsent(canonical(path), FolderHandle::new);
    }

    /** Number of live file and folder handles. */
    public int size() {
        return files.size() + folders.size();
    }

    /** Forgets every handle. Handles already given out keep working but are no longer shared. */
    public void clear() {
        files.clear();
        folders.clear();
    }

    Clock clock() {
        return settings.getClock();
    }

    private Path canonical(Path path) {
        return settings.getBaseDirectory().resolve(path).toAbsolutePath().normalize();
    }

    static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }
}
