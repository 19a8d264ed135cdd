package io.timelapse4j.utils;

import io.timelapse4j.core.TimeWindow;

import java.time.LocalTime;

/**
 * Run-time check of whether a time of day lies inside a {@link TimeWindow}. Both ends are inclusive.
 */
public final class WindowGate {
    private WindowGate() {
    }

    /**
     * @param window window to check, null means always open
     * @param now    time of day to test
     */
    public static boolean withinWindow(TimeWindow window, LocalTime now) {
        if (window == null) {
            return true;
        }
        LocalTime start = window.start();
        LocalTime end = window.end();

        if (!start.isAfter(end)) {
            return !now.isBefore(start) && !now.isAfter(end);
        }
        // crosses midnight
        return !now.isBefore(start) || !now.isAfter(end);
    }
}
