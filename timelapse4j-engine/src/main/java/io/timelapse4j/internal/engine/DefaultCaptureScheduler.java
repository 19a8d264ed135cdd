package io.timelapse4j.internal.engine;

import io.timelapse4j.CaptureAction;
import io.timelapse4j.CaptureScheduler;
import io.timelapse4j.config.SchedulerProperties;
import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CaptureResult;
import io.timelapse4j.core.JobInfo;
import io.timelapse4j.core.NextRun;
import io.timelapse4j.core.ReconcileResult;
import io.timelapse4j.core.TimeWindow;
import io.timelapse4j.internal.CameraReconciler;
import io.timelapse4j.internal.CaptureExecutor;
import io.timelapse4j.internal.ConfigChangeDebouncer;
import io.timelapse4j.internal.JobRegistry;
import io.timelapse4j.utils.TriggerCompiler;
import io.timelapse4j.utils.WindowGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process capture scheduler.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Cron-like (hourly, N per day) and fixed-period (every N hours) jobs per camera schedule</li>
 *   <li>Live reconciliation against new configuration snapshots, debounced</li>
 *   <li>Bounded-retry captures on a worker pool, so a slow camera never delays other fires</li>
 * </ul>
 *
 * <p>A dedicated dispatcher thread waits on a {@link DelayQueue} of armed fire times. Each due
 * entry is claimed from the {@link JobRegistry}; entries made stale by a pause, an update or a
 * removal are dropped there. Claimed fires run on the worker pool.
 *
 * <p>Typical usage:
 * <pre>{@code
 * CaptureScheduler scheduler = new DefaultCaptureScheduler(props, action);
 * scheduler.load(cameras);
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class DefaultCaptureScheduler implements CaptureScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultCaptureScheduler.class);

    private final SchedulerProperties props;
    private final TriggerCompiler compiler;
    private final CaptureExecutor executor;
    private final Clock clock;

    private final JobRegistry registry;
    private final CameraReconciler reconciler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final DelayQueue<DelayedFire> queue = new DelayQueue<>();

    private ExecutorService workerPool;
    private Thread dispatcherThread;
    private volatile ConfigChangeDebouncer<Map<String, Camera>> debouncer;

    private final class DelayedFire implements Delayed {
        private final String jobId;
        private final Instant fireAt;

        private DelayedFire(String jobId, Instant fireAt) {
            this.jobId = jobId;
            this.fireAt = fireAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedFire o) {
                return this.fireAt.compareTo(o.fireAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    public DefaultCaptureScheduler(SchedulerProperties props, TriggerCompiler compiler, CaptureExecutor executor, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.registry = new JobRegistry(compiler, clock, this::arm);
        this.reconciler = new CameraReconciler(registry);
    }

    public DefaultCaptureScheduler(SchedulerProperties props, CaptureAction action) {
        this(props, new TriggerCompiler(props.zoneId()), new CaptureExecutor(action), Clock.system(props.zoneId()));
    }

    /**
     * Start dispatching due fires. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "timelapse.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("timelapse.processEvery must be a positive duration");
        }

        Duration drain = Objects.requireNonNull(props.getDrainTimeout(), "timelapse.drainTimeout must not be null");
        if (drain.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("timelapse.drainTimeout must not be negative");
        }

        if (props.getWorkerThreads() <= 0) {
            started.set(false);
            throw new IllegalArgumentException("timelapse.workerThreads must be positive");
        }

        Duration debounce = Objects.requireNonNull(props.getReloadDebounce(), "timelapse.reloadDebounce must not be null");
        if (debounce.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("timelapse.reloadDebounce must not be negative");
        }

        log.info("Capture scheduler starting with processEvery={}, drainTimeout={}, workerThreads={}, zone={}",
                props.getProcessEvery(),
                props.getDrainTimeout(),
                props.getWorkerThreads(),
                compiler.zone());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getWorkerThreads(), r -> {
                Thread t = new Thread(r);
                t.setName("timelapse.workerPool");
                t.setDaemon(true);
                return t;
            });
        }

        debouncer = new ConfigChangeDebouncer<>(debounce, this::reload);

        queue.clear();
        registry.rearmAll();

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("timelapse.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("Capture scheduler started with {} jobs.", registry.jobCount());
    }

    /**
     * Stop firing, drain in-flight captures, then release every job. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Capture scheduler stopping...");

        ConfigChangeDebouncer<Map<String, Camera>> pendingChanges = debouncer;
        debouncer = null;
        if (pendingChanges != null) {
            pendingChanges.close();
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                // a fire claimed before the interrupt must reach the pool before it shuts down
                dispatcherThread.join(Math.max(1000L, props.getProcessEvery().toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (dispatcherThread.isAlive()) {
                log.warn("Dispatcher did not exit in time, continuing shutdown");
            }
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getDrainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Captures still running after drainTimeout={}, interrupting", props.getDrainTimeout());
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        queue.clear();
        registry.clear();
        log.info("Capture scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void load(Map<String, Camera> cameras) {
        Objects.requireNonNull(cameras, "cameras must not be null");
        for (Camera camera : cameras.values()) {
            registry.add(camera);
        }
        log.info("Loaded cameras count={} jobs={}", cameras.size(), registry.jobCount());
    }

    @Override
    public ReconcileResult reload(Map<String, Camera> cameras) {
        Objects.requireNonNull(cameras, "cameras must not be null");
        return reconciler.reconcile(registry.cameras(), cameras);
    }

    @Override
    public void onConfigurationChanged(Map<String, Camera> cameras) {
        Objects.requireNonNull(cameras, "cameras must not be null");
        ConfigChangeDebouncer<Map<String, Camera>> target = debouncer;
        if (target == null) {
            log.debug("Scheduler not running, applying configuration change immediately");
            reload(cameras);
            return;
        }
        target.submit(Map.copyOf(cameras));
    }

    @Override
    public void addOrUpdate(Camera camera) {
        registry.update(camera);
    }

    @Override
    public void remove(String cameraName) {
        registry.remove(cameraName);
    }

    @Override
    public void pause(String cameraName) {
        registry.pause(cameraName);
    }

    @Override
    public void resume(String cameraName) {
        registry.resume(cameraName);
    }

    @Override
    public CaptureResult captureNow(String cameraName) {
        Camera camera = registry.camera(cameraName)
                .orElseThrow(() -> new IllegalArgumentException("No camera registered for name: " + cameraName));
        log.info("Manual capture requested camera={}", cameraName);
        return executor.execute(camera);
    }

    @Override
    public Map<String, List<NextRun>> nextRunTimes() {
        return registry.nextRunTimes();
    }

    @Override
    public List<JobInfo> jobs() {
        return registry.jobs();
    }

    @Override
    public Map<String, Camera> cameras() {
        return registry.cameras();
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private void arm(String jobId, Instant fireAt) {
        queue.offer(new DelayedFire(jobId, fireAt));
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedFire due = queue.poll(props.getProcessEvery().toMillis(), TimeUnit.MILLISECONDS);
                if (due == null) {
                    continue;
                }

                Optional<JobRegistry.Fire> fire = registry.claim(due.jobId, due.fireAt);
                if (fire.isEmpty()) {
                    log.debug("Dropped stale fire id={} fireAt={}", due.jobId, due.fireAt);
                    continue;
                }
                submitToWorker(fire.get());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("timelapse dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(JobRegistry.Fire fire) {
        final String jobId = fire.handle().id();
        final Camera camera = fire.camera();

        workerPool.submit(() -> {
            try {
                Optional<TimeWindow> gate = fire.trigger().gateWindow();
                if (gate.isPresent()) {
                    LocalTime now = LocalTime.ofInstant(nowInstant(), compiler.zone());
                    if (!WindowGate.withinWindow(gate.get(), now)) {
                        log.debug("Skipping capture outside time window camera={} id={} now={}", camera.name(), jobId, now);
                        return;
                    }
                }

                log.debug("Scheduled capture started camera={} id={} scheduledAt={}", camera.name(), jobId, fire.scheduledAt());
                CaptureResult result = executor.execute(camera);
                if (result.isSuccess()) {
                    log.info("Captured frame camera={} id={} path={}", camera.name(), jobId, result.path());
                }
            } catch (Exception e) {
                log.error("timelapse capture job failed camera={} id={} msg={}", camera.name(), jobId, e.getMessage(), e);
            }
        });
    }
}
