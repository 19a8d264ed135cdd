package io.timelapse4j.config;

import io.timelapse4j.CameraSource;
import io.timelapse4j.CaptureScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the capture scheduler start/stop lifecycle with the Spring container lifecycle.
 */
public class TimelapseLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TimelapseLifecycle.class);

    private final CaptureScheduler scheduler;
    private final CameraSource cameraSource;
    private volatile boolean running = false;

    public TimelapseLifecycle(CaptureScheduler scheduler, CameraSource cameraSource) {
        this.scheduler = scheduler;
        this.cameraSource = cameraSource;
    }

    @Override
    public void start() {
        if (cameraSource != null) {
            scheduler.load(cameraSource.cameras());
        } else {
            log.info("No CameraSource bean, starting with an empty camera set");
        }
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
