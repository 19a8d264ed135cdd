package io.timelapse4j;

import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CaptureResult;
import io.timelapse4j.core.JobInfo;
import io.timelapse4j.core.NextRun;
import io.timelapse4j.core.ReconcileResult;

import java.util.List;
import java.util.Map;

/**
 * Main scheduling API.
 *
 * <p>Cameras are registered from a configuration snapshot and kept in sync with later
 * snapshots by reconciliation. Each enabled schedule becomes one or more jobs that fire
 * the injected {@link CaptureAction} through a bounded-retry policy.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.load(config.cameras());
 * scheduler.start();
 *
 * scheduler.onConfigurationChanged(reloaded.cameras());
 * scheduler.pause("front-door");
 *
 * scheduler.stop();
 * }</pre>
 */
public interface CaptureScheduler {

    /**
     * Start dispatching fires. Idempotent.
     */
    void start();

    /**
     * Stop dispatching, wait for in-flight captures to drain, then release all jobs. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Initial population from a configuration snapshot.
     */
    void load(Map<String, Camera> cameras);

    /**
     * Reconcile the registered cameras against a new snapshot right away.
     */
    ReconcileResult reload(Map<String, Camera> cameras);

    /**
     * Report a configuration change. Bursts of notifications are coalesced and only the
     * latest snapshot is reconciled once the debounce delay has passed. While the scheduler is
     * stopped the snapshot is reconciled immediately.
     */
    void onConfigurationChanged(Map<String, Camera> cameras);

    /**
     * Register a camera, replacing every job of an existing camera with the same name.
     */
    void addOrUpdate(Camera camera);

    void remove(String cameraName);

    void pause(String cameraName);

    void resume(String cameraName);

    /**
     * Capture immediately, outside of any schedule, with the camera's retry policy.
     */
    CaptureResult captureNow(String cameraName);

    /**
     * Next fire time of every unpaused job, grouped by camera name.
     */
    Map<String, List<NextRun>> nextRunTimes();

    List<JobInfo> jobs();

    /**
     * Cameras currently known to the scheduler, keyed by name.
     */
    Map<String, Camera> cameras();
}
