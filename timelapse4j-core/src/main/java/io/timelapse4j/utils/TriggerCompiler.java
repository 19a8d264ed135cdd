package io.timelapse4j.utils;

import io.timelapse4j.core.CompiledTrigger;
import io.timelapse4j.core.CronTrigger;
import io.timelapse4j.core.Frequency;
import io.timelapse4j.core.PeriodTrigger;
import io.timelapse4j.core.Schedule;
import io.timelapse4j.core.ScheduleCompileException;
import io.timelapse4j.core.TimeWindow;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a {@link Schedule} into concrete triggers.
 * <p>
 * Supported frequencies:
 * <ul>
 *   <li>HOURLY: minute 0 of every hour, restricted to the window's hours when one is given</li>
 *   <li>INTERVAL: every {@code value} hours; the window is enforced when the job fires</li>
 *   <li>X_PER_DAY: {@code value} daily times spread evenly over the window (or the whole day)</li>
 * </ul>
 * <p>
 * Cron expressions use the Quartz 6-field layout: {@code sec min hour dom month dow}.
 */
public final class TriggerCompiler {

    static final int MINUTES_PER_DAY = 24 * 60;

    private final ZoneId zone;

    public TriggerCompiler(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public TriggerCompiler() {
        this(ZoneId.systemDefault());
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * @throws ScheduleCompileException when the schedule is malformed
     */
    public List<CompiledTrigger> compile(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");

        Frequency frequency = schedule.frequency();
        if (frequency == null) {
            throw new ScheduleCompileException(schedule.name(), "unknown frequency");
        }

        return switch (frequency) {
            case HOURLY -> List.of(hourly(schedule.timeWindow()));
            case INTERVAL -> List.of(interval(schedule));
            case X_PER_DAY -> perDay(schedule);
        };
    }

    private CompiledTrigger hourly(TimeWindow window) {
        String hours = window == null ? "*" : hourRange(window);
        return new CronTrigger("0 0 " + hours + " * * ?", zone);
    }

    private CompiledTrigger interval(Schedule schedule) {
        if (schedule.value() <= 0) {
            throw new ScheduleCompileException(schedule.name(),
                    "interval hours must be positive, got " + schedule.value());
        }
        return new PeriodTrigger(Duration.ofHours(schedule.value()), schedule.timeWindow());
    }

    private List<CompiledTrigger> perDay(Schedule schedule) {
        TimeWindow window = schedule.timeWindow();
        if (window != null && schedule.value() > 1 && window.start().equals(window.end())) {
            throw new ScheduleCompileException(schedule.name(),
                    "time window " + window.start() + "-" + window.end() + " has zero span");
        }

        List<CompiledTrigger> triggers = new ArrayList<>();
        for (LocalTime t : distributedTimes(schedule.value(), window)) {
            triggers.add(new CronTrigger("0 " + t.getMinute() + " " + t.getHour() + " * * ?", zone));
        }
        return triggers;
    }

    /**
     * Cron hour field covering a window: {@code "s-e"}, or {@code "s-23,0-e"} when it wraps midnight.
     */
    public static String hourRange(TimeWindow window) {
        int startHour = window.start().getHour();
        int endHour = window.end().getHour();

        if (startHour == endHour) {
            // e.g. 08:30-08:10 wraps through every other hour
            return window.wrapsMidnight() ? "*" : String.valueOf(startHour);
        }
        if (endHour < startHour) {
            return startHour + "-23,0-" + endHour;
        }
        return startHour + "-" + endHour;
    }

    /**
     * Evenly spaced times of day across a window, both ends inclusive.
     *
     * <p>A single time lands on the window midpoint. Times are returned in firing order,
     * so a window crossing midnight yields e.g. 22:00, 01:00, 04:00. Times that collapse onto
     * the same minute are returned once.
     *
     * @param count  number of times; zero or negative yields an empty list
     * @param window window to spread over, null for 00:00-23:59
     */
    public static List<LocalTime> distributedTimes(int count, TimeWindow window) {
        if (count <= 0) {
            return List.of();
        }

        TimeWindow w = window == null ? TimeWindow.fullDay() : window;
        long start = w.startMinuteOfDay();
        long end = w.endMinuteOfDay();
        if (end <= start) {
            end += MINUTES_PER_DAY;
        }

        if (count == 1) {
            return List.of(toTimeOfDay((start + end) / 2));
        }

        long span = end - start;
        Set<LocalTime> times = new LinkedHashSet<>();
        for (int i = 0; i < count; i++) {
            times.add(toTimeOfDay(start + (i * span) / (count - 1)));
        }
        return List.copyOf(times);
    }

    private static LocalTime toTimeOfDay(long minutes) {
        int m = (int) Math.floorMod(minutes, (long) MINUTES_PER_DAY);
        return LocalTime.of(m / 60, m % 60);
    }
}
