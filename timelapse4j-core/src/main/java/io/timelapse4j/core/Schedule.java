package io.timelapse4j.core;

/**
 * Declarative description of when a camera captures.
 *
 * <p>The meaning of {@code value} depends on the frequency:
 * <ul>
 *   <li>{@link Frequency#HOURLY}: unused</li>
 *   <li>{@link Frequency#INTERVAL}: hours between fires</li>
 *   <li>{@link Frequency#X_PER_DAY}: number of fires per day</li>
 * </ul>
 *
 * <p>A {@code null} frequency stands for a tag the configuration could not resolve;
 * such a schedule is rejected when compiled.
 */
public record Schedule(
        String name,
        Frequency frequency,
        boolean enabled,
        int value,
        TimeWindow timeWindow
) {
    public static final String DEFAULT_NAME = "default";

    public Schedule {
        name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
    }

    public static Schedule hourly(String name, TimeWindow window) {
        return new Schedule(name, Frequency.HOURLY, true, 1, window);
    }

    public static Schedule interval(String name, int hours, TimeWindow window) {
        return new Schedule(name, Frequency.INTERVAL, true, hours, window);
    }

    public static Schedule perDay(String name, int count, TimeWindow window) {
        return new Schedule(name, Frequency.X_PER_DAY, true, count, window);
    }

    public Schedule withEnabled(boolean enabled) {
        return new Schedule(name, frequency, enabled, value, timeWindow);
    }
}
