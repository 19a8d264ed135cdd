package io.timelapse4j.internal;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause between capture attempts.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> TimeUnit.NANOSECONDS.sleep(d.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
