package io.timelapse4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Coalesces bursts of change notifications. Every submission restarts the delay, and only
 * the newest value reaches the target once the burst is over.
 */
public class ConfigChangeDebouncer<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConfigChangeDebouncer.class);

    private final Duration delay;
    private final Consumer<T> target;
    private final ScheduledExecutorService timer;

    private ScheduledFuture<?> pending;
    private T latest;
    // bumped by every submit and cancel; a flush only delivers for the generation that scheduled it
    private long generation;

    public ConfigChangeDebouncer(Duration delay, Consumer<T> target) {
        this.delay = Objects.requireNonNull(delay, "delay must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("timelapse.reloadDebounce");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void submit(T value) {
        latest = value;
        if (pending != null) {
            pending.cancel(false);
        }
        long scheduledFor = ++generation;
        pending = timer.schedule(() -> flush(scheduledFor), delay.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Change notification received, flushing in {}", delay);
    }

    /**
     * Drop a pending notification without delivering it.
     */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        latest = null;
        generation++;
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    void flush(long scheduledFor) {
        T value;
        synchronized (this) {
            if (scheduledFor != generation) {
                // superseded by a later submit, which scheduled its own flush
                return;
            }
            value = latest;
            latest = null;
            pending = null;
        }
        if (value == null) {
            return;
        }
        try {
            target.accept(value);
        } catch (Exception e) {
            log.error("Applying debounced change failed msg={}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        cancel();
        timer.shutdownNow();
    }
}
