package io.timelapse4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-period trigger. The phase is anchored at registration time, so a time-of-day
 * restriction cannot be expressed here and is carried as a gate window instead.
 */
public record PeriodTrigger(Duration period, TimeWindow window) implements CompiledTrigger {

    public PeriodTrigger {
        Objects.requireNonNull(period, "period must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be a positive duration: " + period);
        }
    }

    @Override
    public Instant firstFire(Instant registeredAt) {
        return registeredAt.plus(period);
    }

    @Override
    public Instant nextFire(Instant scheduled, Instant now) {
        if (scheduled == null) {
            return now.plus(period);
        }
        Instant next = scheduled.plus(period);
        if (next.isAfter(now)) {
            return next;
        }
        long periodMs = period.toMillis();
        long behindMs = Duration.between(next, now).toMillis();
        long skip = behindMs / periodMs + 1;
        return next.plusMillis(skip * periodMs);
    }

    @Override
    public Optional<TimeWindow> gateWindow() {
        return Optional.ofNullable(window);
    }

    @Override
    public String describe() {
        String base = "every " + period;
        return window == null ? base : base + " within " + window.start() + "-" + window.end();
    }
}
