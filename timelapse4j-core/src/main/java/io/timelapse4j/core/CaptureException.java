package io.timelapse4j.core;

/**
 * Stream open, read or write failure of a single capture attempt.
 */
public class CaptureException extends Exception {
    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
