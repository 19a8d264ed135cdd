package io.timelapse4j.core;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Time-of-day window. {@code end} before {@code start} denotes a window crossing midnight.
 */
public record TimeWindow(LocalTime start, LocalTime end) {

    public static final LocalTime DEFAULT_START = LocalTime.of(0, 0);
    public static final LocalTime DEFAULT_END = LocalTime.of(23, 59);

    public TimeWindow {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }

    public static TimeWindow of(String start, String end) {
        return new TimeWindow(LocalTime.parse(start), LocalTime.parse(end));
    }

    public static TimeWindow fullDay() {
        return new TimeWindow(DEFAULT_START, DEFAULT_END);
    }

    public boolean wrapsMidnight() {
        return end.isBefore(start);
    }

    public int startMinuteOfDay() {
        return start.getHour() * 60 + start.getMinute();
    }

    public int endMinuteOfDay() {
        return end.getHour() * 60 + end.getMinute();
    }
}
