package com.foamcase.store;

import com.foamcase.dict.FoamDictionaries;
import com.foamcase.dict.parser.FoamParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The files of one simulation case directory, addressed by path relative to the case or by bare file name.
 * Snapshot files are never listed.
 */
public final class CaseDirectory {
    static final String CONTROL_DICT = "system/controlDict";

    private final FileRegistry registry;
    private final FolderHandle directory;
    private List<FileHandle> files = List.of();

    public CaseDirectory(FileRegistry registry, String directory) throws IOException {
        this(registry, registry.folder(directory));
    }

    public CaseDirectory(FileRegistry registry, FolderHandle directory) throws IOException {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.directory = Objects.requireNonNull(directory, "directory");
        load();
    }

    public FolderHandle getDirectory() {
        return directory;
    }

    /** Files found by the last {@link #load()}, in path order. */
    public List<FileHandle> getFiles() {
        return files;
    }

    /** Rescans the case directory recursively. */
    public void load() throws IOException {
        if (!directory.exists()) {
            files = List.of();
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory.getPath())) {
            paths =
                    walk.filter(Files::isRegularFile)
                            .filter(path -> !FileRegistry.fileName(path).contains("snapshot"))
                            .sorted()
                            .collect(Collectors.toList());
        }
        List<FileHandle> loaded = new ArrayList<>(paths.size());
        for (Path path : paths) {
            loaded.add(registry.file(path));
        }
        files = List.copyOf(loaded);
    }

    public boolean contains(FileHandle file) {
        return directory.contains(file);
    }

    /**
     * Looks a file up by absolute path, by path relative to the case directory, or, when no such file exists,
     * by a name that only one loaded file carries.
     *
     * @throws FileIdentityException if several loaded files carry that name
     * @throws NoSuchFileException if nothing matches
     */
    public FileHandle get(String pathOrName) throws IOException, FileIdentityException {
        Path resolved = resolve(pathOrName);
        if (Files.exists(resolved)) {
            return registry.file(resolved);
        }
        FileHandle match = null;
        for (FileHandle file : files) {
            if (file.getName().equals(pathOrName)) {
                if (match != null) {
                    throw new FileIdentityException(
                            "Multiple files with name '" + pathOrName + "' found in " + directory.getPath() + ".");
                }
                match = file;
            }
        }
        if (match == null) {
            throw new NoSuchFileException(resolved.toString(), null, "File does not exist");
        }
        return match;
    }

    /** Writes {@code content} to a file of this case, creating the file if needed. */
    public void put(String path, String content) throws IOException, FileIdentityException {
        put(registry.file(resolve(path)), content);
    }

    public void put(FileHandle file, String content) throws IOException, FileIdentityException {
        if (!contains(file)) {
            throw new FileIdentityException("File " + file.getPath() + " escapes the case directory.");
        }
        file.setContent(content);
    }

    /**
     * The solver named by {@code system/controlDict}, read fresh from disk.
     *
     * @return the application name, or null if the control dictionary does not name one
     * @throws NoSuchFileException if the case has no control dictionary
     */
    public String applicationName() throws IOException, FoamParseException {
        FileHandle controlDict = registry.file(directory.getPath().resolve(CONTROL_DICT));
        return FoamDictionaries.applicationName(controlDict.getContent());
    }

    private Path resolve(String pathOrName) {
        return registry.resolvePath(pathOrName, directory.getPath());
    }

    @Override
    public String toString() {
        return "Case(" + directory.getPath() + ", " + files.size() + " files)";
    }
}
