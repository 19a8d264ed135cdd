package io.timelapse4j.core;

import java.nio.file.Path;

/**
 * Outcome of one capture fire.
 *
 * path      : produced file, null when no frame was captured
 * lastError : error of the final failed attempt, null on success or skip
 * attempts  : number of times the capture action was invoked
 */
public record CaptureResult(
        Path path,
        CaptureException lastError,
        int attempts
) {

    public static CaptureResult success(Path path, int attempts) {
        return new CaptureResult(path, null, attempts);
    }

    public static CaptureResult skipped() {
        return new CaptureResult(null, null, 0);
    }

    public static CaptureResult failed(CaptureException lastError, int attempts) {
        return new CaptureResult(null, lastError, attempts);
    }

    public boolean isSuccess() {
        return path != null;
    }
}
