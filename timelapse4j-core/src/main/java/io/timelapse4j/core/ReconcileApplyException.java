package io.timelapse4j.core;

/**
 * Failure while applying a configuration change to one camera.
 */
public class ReconcileApplyException extends TimelapseException {
    private final String cameraName;

    public ReconcileApplyException(String cameraName, String operation, Throwable cause) {
        super("Failed to " + operation + " camera '" + cameraName + "': " + cause.getMessage(), cause);
        this.cameraName = cameraName;
    }

    public String getCameraName() {
        return cameraName;
    }
}
