package io.timelapse4j.core;

import java.time.Instant;

/**
 * Introspection view of one registered job.
 *
 * nextFireAt : null while the job is paused
 * trigger    : human-readable trigger description
 */
public record JobInfo(
        String jobId,
        String cameraName,
        String scheduleName,
        String trigger,
        Instant nextFireAt,
        boolean paused
) {
}
