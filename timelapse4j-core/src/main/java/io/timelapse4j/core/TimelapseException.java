package io.timelapse4j.core;

/**
 * Base type for unchecked timelapse4j failures.
 */
public class TimelapseException extends RuntimeException {
    public TimelapseException(String message) {
        super(message);
    }

    public TimelapseException(String message, Throwable cause) {
        super(message, cause);
    }
}
