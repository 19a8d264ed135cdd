package io.timelapse4j.internal;

import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CompiledTrigger;
import io.timelapse4j.core.JobHandle;
import io.timelapse4j.core.JobInfo;

import java.time.Instant;

/**
 * Registry-side state of one job. Mutated only while holding the registry write lock.
 */
final class ScheduledJob {
    private final JobHandle handle;
    private final Camera camera;
    private final CompiledTrigger trigger;

    private Instant nextFireAt;
    private boolean paused;

    ScheduledJob(JobHandle handle, Camera camera, CompiledTrigger trigger) {
        this.handle = handle;
        this.camera = camera;
        this.trigger = trigger;
    }

    JobHandle getHandle() {
        return handle;
    }

    Camera getCamera() {
        return camera;
    }

    CompiledTrigger getTrigger() {
        return trigger;
    }

    Instant getNextFireAt() {
        return nextFireAt;
    }

    void setNextFireAt(Instant nextFireAt) {
        this.nextFireAt = nextFireAt;
    }

    boolean isPaused() {
        return paused;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    JobInfo toInfo() {
        return new JobInfo(
                handle.id(),
                handle.cameraName(),
                handle.scheduleName(),
                trigger.describe(),
                nextFireAt,
                paused
        );
    }
}
