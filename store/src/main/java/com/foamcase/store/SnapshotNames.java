package com.foamcase.store;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Snapshot files sit next to the file they preserve and are named {@code <name>-snapshot-<yyyyMMddHHmmss>}.
 * Sorting the names therefore sorts the snapshots oldest first.
 */
final class SnapshotNames {
    static final String MARKER = "-snapshot-";
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT);

    private SnapshotNames() {}

    static boolean isSnapshot(String fileName) {
        return fileName.contains(MARKER);
    }

    static boolean isSnapshotOf(String fileName, String candidate) {
        return candidate.startsWith(fileName + MARKER);
    }

    static String snapshotName(String fileName, Clock clock) {
        return fileName + MARKER + TIMESTAMP.format(LocalDateTime.now(clock));
    }

    /**
     * The counter carried by {@code candidate} when it is {@code snapshotName} itself (0) or one of its
     * counter variants; -1 for any other name.
     */
    static int counterOf(String snapshotName, String candidate) {
        if (candidate.equals(snapshotName)) {
            return 0;
        }
        String prefix = snapshotName + "-";
        if (!candidate.startsWith(prefix)) {
            return -1;
        }
        String suffix = candidate.substring(prefix.length());
        if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        try {
            return Integer.parseInt(suffix);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    /** Disambiguates a second snapshot taken within the same second; still sorts after the first. */
    static String withCounter(String snapshotName, int counter) {
        return String.format(Locale.ROOT, "%s-%03d", snapshotName, counter);
    }
}
