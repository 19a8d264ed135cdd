package io.timelapse4j.core;

import java.util.Objects;

/**
 * Identity of one registered trigger. Handles are never reused across registrations.
 */
public record JobHandle(String id, String cameraName, String scheduleName) {
    public JobHandle {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(cameraName, "cameraName must not be null");
    }

    @Override
    public String toString() {
        return id;
    }
}
