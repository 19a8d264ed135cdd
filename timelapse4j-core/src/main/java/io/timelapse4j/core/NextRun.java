package io.timelapse4j.core;

import java.time.Instant;

public record NextRun(String jobId, Instant nextFireAt) {
}
