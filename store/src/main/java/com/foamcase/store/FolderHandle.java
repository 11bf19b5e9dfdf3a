package com.foamcase.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/** A directory identified by its canonical path. Obtain instances from {@link FileRegistry#folder}. */
public final class FolderHandle {
    private static final Logger LOGGER = Logger.getLogger(FolderHandle.class.getName());

    private final Path path;

    FolderHandle(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public String getName() {
        return FileRegistry.fileName(path);
    }

    public boolean exists() {
        return Files.isDirectory(path);
    }

    /** Creates the directory and any missing parents; does nothing if it already exists. */
    public void ensureExistence(boolean warnIfMissing) throws IOException {
        if (exists()) {
            return;
        }
        if (warnIfMissing) {
            LOGGER.warning("Folder " + path + " does not exist. Creating it now.");
        }
        Files.createDirectories(path);
    }

    /** Whether {@code file} lies somewhere below this directory, compared by path components. */
    public boolean contains(FileHandle file) {
        return file.getPath().startsWith(path) && !file.getPath().equals(path);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FolderHandle)) {
            return false;
        }
        return path.equals(((FolderHandle) obj).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "Folder(path=" + path + ", exists=" + exists() + ")";
    }
}
