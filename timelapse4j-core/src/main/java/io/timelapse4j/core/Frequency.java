package io.timelapse4j.core;

import java.util.Locale;

public enum Frequency {
    HOURLY("hourly"),
    INTERVAL("interval"),
    X_PER_DAY("x_per_day");

    private final String tag;

    Frequency(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolve a configuration tag such as {@code "x_per_day"}.
     *
     * @return the matching frequency, or {@code null} when the tag is not recognized
     */
    public static Frequency fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Frequency f : values()) {
            if (f.tag.equals(normalized) || f.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return f;
            }
        }
        return null;
    }
}
