package io.timelapse4j.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable camera definition as delivered by configuration.
 *
 * <p>Equality is structural over every field, nested schedules and policy included.
 * The scheduling engine relies on this to decide whether a camera changed between
 * two configuration snapshots.
 */
public record Camera(

        // identity
        String name,
        String url,
        boolean enabled,

        // scheduling
        List<Schedule> schedules,

        // capture behavior
        CapturePolicy policy
) {
    public Camera {
        Objects.requireNonNull(name, "camera name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("camera name must not be blank");
        }
        url = url == null ? "" : url;
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
        policy = policy == null ? CapturePolicy.defaults() : policy;
    }

    public Camera withEnabled(boolean enabled) {
        return new Camera(name, url, enabled, schedules, policy);
    }

    public Camera withSchedules(List<Schedule> schedules) {
        return new Camera(name, url, enabled, schedules, policy);
    }

    public Camera withPolicy(CapturePolicy policy) {
        return new Camera(name, url, enabled, schedules, policy);
    }
}
