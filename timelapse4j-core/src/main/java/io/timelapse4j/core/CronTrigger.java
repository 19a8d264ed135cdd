package io.timelapse4j.core;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Calendar trigger backed by a Quartz cron expression (seconds field first).
 */
public record CronTrigger(String cronExpression, ZoneId zone) implements CompiledTrigger {

    public CronTrigger {
        Objects.requireNonNull(cronExpression, "cronExpression must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (!CronExpression.isValidExpression(cronExpression)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression);
        }
    }

    @Override
    public Instant firstFire(Instant registeredAt) {
        return nextValidAfter(registeredAt);
    }

    @Override
    public Instant nextFire(Instant scheduled, Instant now) {
        Instant base = scheduled == null || now.isAfter(scheduled) ? now : scheduled;
        return nextValidAfter(base);
    }

    @Override
    public String describe() {
        return "cron[" + cronExpression + "] " + zone.getId();
    }

    private Instant nextValidAfter(Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cronExpression);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalStateException("Cron expression produced no next execution time: " + cronExpression);
        }
        return next.toInstant();
    }
}
