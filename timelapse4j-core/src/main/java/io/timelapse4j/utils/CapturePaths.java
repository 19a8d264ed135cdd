package io.timelapse4j.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Destination layout for captured frames:
 * {@code <root>/<camera>/<yyyy-MM>/<camera>_<yyyy-MM-dd_HH-mm-ss-SSS>.jpg}.
 *
 * <p>The stamp carries milliseconds so overlapping fires of one camera within the same second
 * write distinct files.
 */
public final class CapturePaths {

    public static final String EXTENSION = ".jpg";

    private static final DateTimeFormatter MONTH_DIR = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS");
    private static final int STAMP_LENGTH = 23;

    private final Path root;

    public CapturePaths(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public Path root() {
        return root;
    }

    /**
     * Resolve the file for a frame taken at {@code takenAt}, creating the month directory if needed.
     */
    public Path resolve(String cameraName, LocalDateTime takenAt) throws IOException {
        Objects.requireNonNull(cameraName, "cameraName must not be null");
        Objects.requireNonNull(takenAt, "takenAt must not be null");

        Path dir = root.resolve(cameraName).resolve(MONTH_DIR.format(takenAt));
        Files.createDirectories(dir);
        return dir.resolve(fileName(cameraName, takenAt));
    }

    public static String fileName(String cameraName, LocalDateTime takenAt) {
        return cameraName + "_" + FILE_STAMP.format(takenAt) + EXTENSION;
    }

    /**
     * Timestamp encoded in a capture file name, or empty when the name does not follow the layout.
     */
    public static Optional<LocalDateTime> parseTimestamp(Path file) {
        String name = file.getFileName().toString();
        if (!name.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String stem = name.substring(0, name.length() - EXTENSION.length());
        int sep = stem.indexOf('_');
        if (sep < 0) {
            return Optional.empty();
        }
        // camera names may contain underscores, the stamp is always the trailing characters
        String stamp = stem.length() >= STAMP_LENGTH ? stem.substring(stem.length() - STAMP_LENGTH) : "";
        try {
            return Optional.of(LocalDateTime.parse(stamp, FILE_STAMP));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
