package io.timelapse4j.core;

/**
 * A schedule that cannot be turned into triggers. Only the offending schedule is skipped.
 */
public class ScheduleCompileException extends TimelapseException {
    private final String scheduleName;

    public ScheduleCompileException(String scheduleName, String message) {
        super("Schedule '" + scheduleName + "': " + message);
        this.scheduleName = scheduleName;
    }

    public String getScheduleName() {
        return scheduleName;
    }
}
