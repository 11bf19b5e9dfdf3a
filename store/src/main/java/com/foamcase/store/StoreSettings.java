package com.foamcase.store;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Settings a {@link FileRegistry} is created with. {@link #fromSystemProperties()} reads
 * {@code foamcase.store.autosave} (default {@code true}) and {@code foamcase.store.baseDir} (default the
 * working directory); the clock and environment default to the system ones and are replaced in tests.
 */
public final class StoreSettings {
    static final String AUTOSAVE_PROPERTY = "foamcase.store.autosave";
    static final String BASE_DIR_PROPERTY = "foamcase.store.baseDir";

    private final boolean autosave;
    private final Path baseDirectory;
    private final Clock clock;
    private final Map<String, String> environment;

    private StoreSettings(boolean autosave, Path baseDirectory, Clock clock, Map<String, String> environment) {
        this.autosave = autosave;
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.environment = Map.copyOf(environment);
    }

    public static StoreSettings defaults() {
        return new StoreSettings(true, Paths.get(""), Clock.systemDefaultZone(), System.getenv());
    }

    public static StoreSettings fromSystemProperties() {
        String autosave = System.getProperty(AUTOSAVE_PROPERTY);
        String baseDir = System.getProperty(BASE_DIR_PROPERTY);
        return new StoreSettings(
                autosave == null || Boolean.parseBoolean(autosave),
                baseDir == null || baseDir.isBlank() ? Paths.get("") : Paths.get(baseDir),
                Clock.systemDefaultZone(),
                System.getenv());
    }

    public StoreSettings withAutosave(boolean value) {
        return new StoreSettings(value, baseDirectory, clock, environment);
    }

    public StoreSettings withBaseDirectory(Path value) {
        return new StoreSettings(autosave, Objects.requireNonNull(value, "baseDirectory"), clock, environment);
    }

    public StoreSettings withClock(Clock value) {
        return new StoreSettings(autosave, baseDirectory, value, environment);
    }

    public StoreSettings withEnvironment(Map<String, String> value) {
        return new StoreSettings(autosave, baseDirectory, clock, Objects.requireNonNull(value, "environment"));
    }

    public boolean isAutosave() {
        return autosave;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public Clock getClock() {
        return clock;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }
}
