package com.foamcase.store;

import com.foamcase.dict.Version;
import com.foamcase.dict.lexer.DebugFlags;
import com.foamcase.dict.parser.FoamDictBuilder;
import com.foamcase.dict.parser.FoamDictParser;
import com.foamcase.dict.parser.FoamParseException;
import com.foamcase.dict.value.FoamDict;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A dictionary file identified by its canonical path. Obtain instances from {@link FileRegistry#file}; two
 * handles are equal exactly when their paths are.
 *
 * <p>An autosaving handle copies the current file into a snapshot before every overwrite, so earlier
 * versions can be restored with {@link #rollback}. Snapshot handles are plain files: they never autosave
 * and have no snapshots of their own.
 *
 * <p>{@link #structured()} parses the file once and keeps the tree for the lifetime of the handle. Later
 * changes to the file on disk, rollbacks included, do not refresh it; call {@link #discardStructured()} to
 * read the file again on next access.
 */
public final class FileHandle {
    private static final Logger LOGGER = Logger.getLogger(FileHandle.class.getName());
    private static final int RECENT_TOKEN_LIMIT = 10;
    private static final Comparator<FileHandle> BY_NAME = Comparator.comparing(FileHandle::getName);

    private final FileRegistry registry;
    private final Path path;
    private final boolean autosave;
    private final boolean snapshot;
    private final List<FileHandle> snapshots = new ArrayList<>();
    private FoamDict structured;

    FileHandle(FileRegistry registry, Path path, boolean autosave, boolean snapshot) {
        this.registry = registry;
        this.path = path;
        this.autosave = autosave;
        this.snapshot = snapshot;
    }

    void discoverSnapshots() throws IOException {
        Path folder = path.getParent();
        if (folder == null || !Files.isDirectory(folder)) {
            return;
        }
        String name = getName();
        List<Path> found;
        try (Stream<Path> entries = Files.list(folder)) {
            found =
                    entries.filter(entry -> SnapshotNames.isSnapshotOf(name, FileRegistry.fileName(entry)))
                            .filter(Files::isRegularFile)
                            .collect(Collectors.toList());
        }
        for (Path entry : found) {
            snapshots.add(registry.file(entry));
        }
        snapshots.sort(BY_NAME);
    }

    public Path getPath() {
        return path;
    }

    public String getName() {
        return FileRegistry.fileName(path);
    }

    public FolderHandle getFolder() {
        return registry.folder(path.getParent());
    }

    public boolean exists() {
        return Files.exists(path);
    }

    public boolean isSnapshot() {
        return snapshot;
    }

    public boolean isAutosave() {
        return autosave;
    }

    /** Registered snapshots, oldest first. */
    public List<FileHandle> getSnapshots() {
        return List.copyOf(snapshots);
    }

    public boolean isInside(FolderHandle folder) {
        return folder.contains(this);
    }

    public void ensureExistence(boolean warnIfMissing) throws IOException {
        ensureExistence(true, warnIfMissing);
    }

    /** Creates the file empty if it is missing; an existing file is left untouched. */
    public void ensureExistence(boolean createParents, boolean warnIfMissing) throws IOException {
        if (exists()) {
            return;
        }
        if (warnIfMissing) {
            LOGGER.warning("File " + path + " does not exist. Creating it now.");
        }
        if (createParents) {
            getFolder().ensureExistence(warnIfMissing);
        }
        Files.writeString(path, "", StandardCharsets.UTF_8);
    }

    public String getContent() throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Replaces the file content. An autosaving handle whose file already exists first preserves the current
     * content as a new snapshot.
     */
    public void setContent(String content) throws IOException {
        Objects.requireNonNull(content, "content");
        if (autosave && exists()) {
            takeSnapshot();
        }
        writeContent(content);
    }

    /**
     * The parsed dictionary, read from disk on first access. Edits made to the returned tree stay in memory
     * until {@link #save()}.
     *
     * @throws NoSuchFileException if the file does not exist
     */
    public FoamDict structured() throws IOException, FoamParseException {
        if (structured == null) {
            if (!exists()) {
                throw new NoSuchFileException(path.toString(), null, "File does not exist");
            }
            String content = getContent();
            if (DebugFlags.isTokenDebugEnabled()) {
                DebugFlags.drainCapturedTokens();
            }
            try {
                structured = new FoamDictParser().parse(path.toString(), content);
            } catch (FoamParseException ex) {
                throw describeParseFailure(ex);
            }
        }
        return structured;
    }

    public boolean isStructured() {
        return structured != null;
    }

    public void discardStructured() {
        structured = null;
    }

    /** Writes the cached tree back through {@link #setContent}, snapshotting like any other write. */
    public void save() throws IOException, FileIdentityException {
        if (structured == null) {
            throw new FileIdentityException("Nothing to save for " + path + ": the file was never parsed.");
        }
        setContent(new FoamDictBuilder().build(structured));
    }

    /**
     * Restores the content of {@code target} into this file and deletes that snapshot. The restoring write
     * itself does not create a snapshot; other snapshots are kept.
     */
    public void rollback(FileHandle target) throws IOException, FileIdentityException {
        requireOwnSnapshot(target);
        writeContent(target.getContent());
        Files.deleteIfExists(target.path);
        snapshots.remove(target);
        LOGGER.fine(() -> "Rolled back " + path + " to " + target.getName());
    }

    /** Deletes the file if present, together with all of its snapshots. */
    public void delete() throws IOException {
        Files.deleteIfExists(path);
        deleteSnapshots();
    }

    public void deleteSnapshots() throws IOException {
        for (FileHandle existing : snapshots) {
            Files.deleteIfExists(existing.path);
        }
        if (!snapshots.isEmpty()) {
            LOGGER.fine(() -> "Deleted " + snapshots.size() + " snapshot(s) of " + path);
        }
        snapshots.clear();
    }

    public void deleteSnapshot(FileHandle target) throws IOException, FileIdentityException {
        requireOwnSnapshot(target);
        Files.deleteIfExists(target.path);
        snapshots.remove(target);
    }

    private void requireOwnSnapshot(FileHandle target) throws FileIdentityException {
        Objects.requireNonNull(target, "target");
        if (!snapshots.contains(target)) {
            throw new FileIdentityException(
                    "Snapshot " + target.getPath() + " is not a snapshot of " + path + ".");
        }
    }

    private void takeSnapshot() throws IOException {
        String current = getContent();
        String baseName = SnapshotNames.snapshotName(getName(), registry.clock());
        // Counters only grow within a second, so a rolled back name is never reused ahead of a newer one.
        int highest = -1;
        for (FileHandle existing : snapshots) {
            highest = Math.max(highest, SnapshotNames.counterOf(baseName, existing.getName()));
        }
        int counter = highest + 1;
        Path target = counter == 0 ? path.resolveSibling(baseName) : siblingWithCounter(baseName, counter);
        while (Files.exists(target)) {
            target = siblingWithCounter(baseName, ++counter);
        }
        Files.writeString(target, current, StandardCharsets.UTF_8);
        FileHandle created = registry.file(target);
        if (!snapshots.contains(created)) {
            snapshots.add(created);
            snapshots.sort(BY_NAME);
        }
        LOGGER.fine(() -> "Snapshot " + created.getName() + " taken of " + path);
    }

    private Path siblingWithCounter(String baseName, int counter) {
        return path.resolveSibling(SnapshotNames.withCounter(baseName, counter));
    }

    private void writeContent(String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private FoamParseException describeParseFailure(FoamParseException ex) {
        StringBuilder message = new StringBuilder(ex.getMessage());
        if (DebugFlags.isTokenDebugEnabled()) {
            List<String> tokens = DebugFlags.drainCapturedTokens();
            if (!tokens.isEmpty()) {
                message.append("\nRecent tokens:\n");
                int start = Math.max(0, tokens.size() - RECENT_TOKEN_LIMIT);
                for (int i = start; i < tokens.size(); i++) {
                    message.append("  ").append(tokens.get(i)).append('\n');
                }
            }
        }
        return new FoamParseException(
                "[Version " + Version.FULL + "] Failed to parse dictionary: "
                        + path
                        + " ("
                        + message.toString().trim()
                        + ")",
                ex);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FileHandle)) {
            return false;
        }
        return path.equals(((FileHandle) obj).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "File(path=" + path + ", name=" + getName() + ", exists=" + exists() + ")";
    }
}
