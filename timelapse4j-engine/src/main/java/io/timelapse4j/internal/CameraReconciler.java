package io.timelapse4j.internal;

import io.timelapse4j.core.Camera;
import io.timelapse4j.core.ReconcileApplyException;
import io.timelapse4j.core.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converges the {@link JobRegistry} from one configuration snapshot to the next.
 *
 * <ol>
 *   <li>names only in the old snapshot are removed</li>
 *   <li>names only in the new snapshot are added</li>
 *   <li>names in both whose camera changed structurally are updated</li>
 * </ol>
 *
 * Each camera is applied on its own: a failure is logged, reported in
 * {@link ReconcileResult#failed()} and leaves that camera's previous jobs in effect.
 */
public class CameraReconciler {
    private static final Logger log = LoggerFactory.getLogger(CameraReconciler.class);

    private final JobRegistry registry;

    public CameraReconciler(JobRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public ReconcileResult reconcile(Map<String, Camera> oldCameras, Map<String, Camera> newCameras) {
        Map<String, Camera> previous = oldCameras == null ? Map.of() : oldCameras;
        Map<String, Camera> next = newCameras == null ? Map.of() : newCameras;

        List<String> removed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String name : previous.keySet()) {
            if (!next.containsKey(name)) {
                apply(name, "remove", () -> registry.remove(name), removed, failed);
            }
        }

        for (var e : next.entrySet()) {
            String name = e.getKey();
            Camera camera = e.getValue();
            if (camera == null) {
                log.warn("Snapshot entry without camera definition, skipping name={}", name);
                continue;
            }
            if (!name.equals(camera.name())) {
                log.warn("Snapshot key does not match camera name key={} name={}", name, camera.name());
            }

            Camera old = previous.get(name);
            if (old == null) {
                apply(name, "add", () -> registry.add(camera), added, failed);
            } else if (!old.equals(camera)) {
                apply(name, "update", () -> registry.update(camera), updated, failed);
            }
        }

        ReconcileResult result = new ReconcileResult(removed, added, updated, failed);
        if (result.hasEffect() || !failed.isEmpty()) {
            log.info("Reconciled cameras removed={} added={} updated={} failed={}", removed, added, updated, failed);
        } else {
            log.debug("Reconciled cameras, nothing changed");
        }
        return result;
    }

    private void apply(String name, String operation, Runnable change, List<String> done, List<String> failed) {
        try {
            change.run();
            done.add(name);
        } catch (RuntimeException e) {
            ReconcileApplyException failure = new ReconcileApplyException(name, operation, e);
            log.error("{}", failure.getMessage(), failure);
            failed.add(failure.getCameraName());
        }
    }
}
