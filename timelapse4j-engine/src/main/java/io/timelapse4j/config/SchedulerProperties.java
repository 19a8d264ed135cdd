package io.timelapse4j.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for capture scheduling behavior.
 */
@ConfigurationProperties(prefix = "timelapse")
public class SchedulerProperties {
    private boolean enabled = true;
    private int workerThreads = 4;
    private Duration processEvery = Duration.ofSeconds(1); // max dispatcher sleep
    private Duration drainTimeout = Duration.ofSeconds(60);
    private Duration reloadDebounce = Duration.ofSeconds(1);
    private String timezone; // IANA id, null means system default

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Duration getReloadDebounce() {
        return reloadDebounce;
    }

    public void setReloadDebounce(Duration reloadDebounce) {
        this.reloadDebounce = reloadDebounce;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    /**
     * Zone used for cron triggers and time windows. Falls back to the system default
     * when {@code timezone} is unset or unknown.
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }
}
