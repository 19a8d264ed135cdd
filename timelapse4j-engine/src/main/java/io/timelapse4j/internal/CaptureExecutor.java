package io.timelapse4j.internal;

import io.timelapse4j.CaptureAction;
import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CaptureException;
import io.timelapse4j.core.CapturePolicy;
import io.timelapse4j.core.CaptureResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs a {@link CaptureAction} under the camera's retry policy.
 *
 * <p>Attempts are made up to {@code retryCount} times with an exponential backoff of
 * {@code retryDelaySeconds * 2^i} after the failed attempt {@code i}. Exhausting all attempts is a
 * recovered failure: the result carries the last error and nothing is thrown.
 */
public class CaptureExecutor {
    private static final Logger log = LoggerFactory.getLogger(CaptureExecutor.class);

    private final CaptureAction action;
    private final Sleeper sleeper;

    public CaptureExecutor(CaptureAction action, Sleeper sleeper) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public CaptureExecutor(CaptureAction action) {
        this(action, Sleeper.SYSTEM);
    }

    public CaptureResult execute(Camera camera) {
        Objects.requireNonNull(camera, "camera must not be null");

        if (!camera.enabled()) {
            log.debug("Camera is disabled, skipping capture camera={}", camera.name());
            return CaptureResult.skipped();
        }

        CapturePolicy policy = camera.policy();
        int attempts = Math.max(1, policy.retryCount());
        CaptureException lastError = null;

        for (int i = 0; i < attempts; i++) {
            try {
                Path path = action.capture(camera);
                log.debug("Capture succeeded camera={} attempt={} path={}", camera.name(), i + 1, path);
                return CaptureResult.success(path, i + 1);
            } catch (CaptureException e) {
                lastError = e;
                log.warn("Capture attempt {}/{} failed camera={} msg={}", i + 1, attempts, camera.name(), e.getMessage());
            }

            if (i < attempts - 1) {
                Duration delay = policy.backoffAfter(i);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Capture retries interrupted camera={} attempts={}", camera.name(), i + 1);
                    return CaptureResult.failed(lastError, i + 1);
                }
            }
        }

        log.error("All capture attempts failed camera={} attempts={} msg={}",
                camera.name(), attempts, lastError.getMessage(), lastError);
        return CaptureResult.failed(lastError, attempts);
    }
}
