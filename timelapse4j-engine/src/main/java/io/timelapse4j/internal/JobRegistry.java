package io.timelapse4j.internal;

import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CompiledTrigger;
import io.timelapse4j.core.Frequency;
import io.timelapse4j.core.JobHandle;
import io.timelapse4j.core.JobInfo;
import io.timelapse4j.core.NextRun;
import io.timelapse4j.core.Schedule;
import io.timelapse4j.core.ScheduleCompileException;
import io.timelapse4j.utils.TriggerCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative map from camera name to its live jobs.
 *
 * <p>Per camera name the lifecycle is absent, active, absent. Registering a name that is
 * already present tears the old jobs down first, so a name never owns duplicate jobs.
 * Updates are coarse: all jobs of the camera are replaced, schedules are never diffed.
 *
 * <p>Mutations and fire claims take the write lock, so a job can never be claimed while
 * its camera is being torn down. Whenever a job gets a new fire time the {@link ArmListener}
 * is told, which is how the dispatcher learns what to wait for.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    @FunctionalInterface
    public interface ArmListener {
        void armed(String jobId, Instant fireAt);
    }

    /**
     * A fire claimed by the dispatcher.
     */
    public record Fire(
            JobHandle handle,
            Camera camera,
            CompiledTrigger trigger,
            Instant scheduledAt,
            Instant nextFireAt
    ) {
    }

    private final TriggerCompiler compiler;
    private final Clock clock;
    private final ArmListener armListener;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Camera> cameras = new LinkedHashMap<>();
    private final Map<String, List<JobHandle>> handlesByCamera = new LinkedHashMap<>();
    private final Map<String, ScheduledJob> jobsById = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public JobRegistry(TriggerCompiler compiler, Clock clock, ArmListener armListener) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.armListener = Objects.requireNonNull(armListener, "armListener must not be null");
    }

    public JobRegistry(TriggerCompiler compiler, Clock clock) {
        this(compiler, clock, (jobId, fireAt) -> {
        });
    }

    /**
     * Register every enabled schedule of the camera. A disabled camera is recorded with no jobs.
     *
     * @return handles now owned by the camera
     */
    public List<JobHandle> add(Camera camera) {
        return install(camera, "Added");
    }

    /**
     * Full teardown and recompile of the camera's jobs.
     */
    public List<JobHandle> update(Camera camera) {
        return install(camera, "Updated");
    }

    /**
     * Unregister every job of the camera and forget it.
     *
     * @return true when the camera was known
     */
    public boolean remove(String cameraName) {
        lock.writeLock().lock();
        try {
            boolean known = cameras.remove(cameraName) != null;
            int removed = teardown(cameraName);
            if (known) {
                log.info("Removed camera={} jobs={}", cameraName, removed);
            } else {
                log.debug("Remove ignored, camera not registered camera={}", cameraName);
            }
            return known;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean pause(String cameraName) {
        lock.writeLock().lock();
        try {
            List<JobHandle> handles = handlesByCamera.get(cameraName);
            if (handles == null) {
                log.warn("Pause ignored, camera not registered camera={}", cameraName);
                return false;
            }
            for (JobHandle h : handles) {
                ScheduledJob job = jobsById.get(h.id());
                if (job == null) {
                    log.warn("Pause skipped missing job id={} camera={}", h.id(), cameraName);
                    continue;
                }
                job.setPaused(true);
                job.setNextFireAt(null);
            }
            log.info("Paused all jobs camera={} jobs={}", cameraName, handles.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean resume(String cameraName) {
        lock.writeLock().lock();
        try {
            List<JobHandle> handles = handlesByCamera.get(cameraName);
            if (handles == null) {
                log.warn("Resume ignored, camera not registered camera={}", cameraName);
                return false;
            }
            Instant now = clock.instant();
            for (JobHandle h : handles) {
                ScheduledJob job = jobsById.get(h.id());
                if (job == null) {
                    log.warn("Resume skipped missing job id={} camera={}", h.id(), cameraName);
                    continue;
                }
                if (job.isPaused()) {
                    job.setPaused(false);
                    arm(job, job.getTrigger().firstFire(now));
                }
            }
            log.info("Resumed all jobs camera={} jobs={}", cameraName, handles.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Claim a fire for the dispatcher and advance the job to its next fire time.
     *
     * @return empty when the job is gone, paused, or {@code scheduledAt} is not its current fire time
     */
    public Optional<Fire> claim(String jobId, Instant scheduledAt) {
        lock.writeLock().lock();
        try {
            ScheduledJob job = jobsById.get(jobId);
            if (job == null || job.isPaused() || !scheduledAt.equals(job.getNextFireAt())) {
                return Optional.empty();
            }
            Instant next = job.getTrigger().nextFire(scheduledAt, clock.instant());
            arm(job, next);
            return Optional.of(new Fire(job.getHandle(), job.getCamera(), job.getTrigger(), scheduledAt, next));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Recompute the fire time of every unpaused job from now. Used when dispatching (re)starts.
     */
    public void rearmAll() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            for (ScheduledJob job : jobsById.values()) {
                if (!job.isPaused()) {
                    arm(job, job.getTrigger().firstFire(now));
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            int jobs = jobsById.size();
            cameras.clear();
            handlesByCamera.clear();
            jobsById.clear();
            log.info("Job registry cleared jobs={}", jobs);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Camera> camera(String cameraName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(cameras.get(cameraName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Camera> cameras() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(cameras));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<JobHandle> handles(String cameraName) {
        lock.readLock().lock();
        try {
            return List.copyOf(handlesByCamera.getOrDefault(cameraName, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String jobId) {
        lock.readLock().lock();
        try {
            return jobsById.containsKey(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int jobCount() {
        lock.readLock().lock();
        try {
            return jobsById.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, List<NextRun>> nextRunTimes() {
        lock.readLock().lock();
        try {
            Map<String, List<NextRun>> result = new LinkedHashMap<>();
            for (var e : handlesByCamera.entrySet()) {
                List<NextRun> runs = new ArrayList<>();
                for (JobHandle h : e.getValue()) {
                    ScheduledJob job = jobsById.get(h.id());
                    if (job != null && job.getNextFireAt() != null) {
                        runs.add(new NextRun(h.id(), job.getNextFireAt()));
                    }
                }
                result.put(e.getKey(), List.copyOf(runs));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<JobInfo> jobs() {
        lock.readLock().lock();
        try {
            List<JobInfo> result = new ArrayList<>();
            for (List<JobHandle> handles : handlesByCamera.values()) {
                for (JobHandle h : handles) {
                    ScheduledJob job = jobsById.get(h.id());
                    if (job != null) {
                        result.add(job.toInfo());
                    }
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<JobHandle> install(Camera camera, String verb) {
        Objects.requireNonNull(camera, "camera must not be null");

        // compile before touching state so a failure leaves the previous jobs in place
        List<ScheduledJob> prepared = camera.enabled() ? compileJobs(camera) : List.of();

        lock.writeLock().lock();
        try {
            int replaced = teardown(camera.name());
            cameras.put(camera.name(), camera);

            List<JobHandle> handles = new ArrayList<>(prepared.size());
            Instant now = clock.instant();
            for (ScheduledJob job : prepared) {
                jobsById.put(job.getHandle().id(), job);
                handles.add(job.getHandle());
                arm(job, job.getTrigger().firstFire(now));
                log.debug("Registered job id={} trigger={} nextFireAt={}",
                        job.getHandle().id(), job.getTrigger().describe(), job.getNextFireAt());
            }
            handlesByCamera.put(camera.name(), handles);

            log.info("{} camera={} enabled={} jobs={} replaced={}", verb, camera.name(), camera.enabled(), handles.size(), replaced);
            return List.copyOf(handles);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<ScheduledJob> compileJobs(Camera camera) {
        List<ScheduledJob> jobs = new ArrayList<>();
        for (Schedule schedule : camera.schedules()) {
            if (!schedule.enabled()) {
                continue;
            }

            List<CompiledTrigger> triggers;
            try {
                triggers = compiler.compile(schedule);
            } catch (ScheduleCompileException e) {
                log.warn("Skipping schedule camera={} schedule={} msg={}", camera.name(), schedule.name(), e.getMessage());
                continue;
            }

            for (int i = 0; i < triggers.size(); i++) {
                JobHandle handle = new JobHandle(jobId(camera, schedule, i), camera.name(), schedule.name());
                jobs.add(new ScheduledJob(handle, camera, triggers.get(i)));
            }
        }
        return jobs;
    }

    private String jobId(Camera camera, Schedule schedule, int index) {
        String kind = schedule.frequency() == Frequency.X_PER_DAY
                ? "daily_" + index
                : schedule.frequency().tag();
        return camera.name() + "_" + schedule.name() + "_" + kind + "#" + sequence.incrementAndGet();
    }

    // caller holds the write lock
    private int teardown(String cameraName) {
        List<JobHandle> handles = handlesByCamera.remove(cameraName);
        if (handles == null) {
            return 0;
        }
        int removed = 0;
        for (JobHandle h : handles) {
            if (jobsById.remove(h.id()) != null) {
                removed++;
                log.debug("Unregistered job id={}", h.id());
            } else {
                log.warn("Job already gone while unregistering id={} camera={}", h.id(), cameraName);
            }
        }
        return removed;
    }

    // caller holds the write lock
    private void arm(ScheduledJob job, Instant fireAt) {
        job.setNextFireAt(fireAt);
        armListener.armed(job.getHandle().id(), fireAt);
    }
}
