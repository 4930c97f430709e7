package io.borgqueue.schedule;

import java.util.Locale;

public enum ScheduleType {
    INTERVAL,
    DAILY,
    WEEKLY,
    MONTHLY,
    CRON,
    ADVANCED;

    /**
     * Parses the lower-case wire value ({@code "weekly"}) as well as the enum name.
     */
    public static ScheduleType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("schedule type must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported schedule type: " + value);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
