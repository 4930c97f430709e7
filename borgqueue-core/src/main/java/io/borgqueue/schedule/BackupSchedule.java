package io.borgqueue.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recurrence policy bound to one backup target.
 *
 * <p>Masks:
 * <ul>
 *   <li>{@code weekdays}: bit 0 = Monday ... bit 6 = Sunday (ISO day n is bit n-1)</li>
 *   <li>{@code monthdays}: bit 0 = day 1 ... bit 30 = day 31</li>
 * </ul>
 *
 * <p>Only the fields matching {@link #type()} are consulted.
 */
public record BackupSchedule(
        long id,
        long targetId,
        ScheduleType type,

        // time of day + IANA zone the schedule is evaluated in
        LocalTime time,
        String timezone,

        Integer weekdays,
        Integer monthdays,
        Integer intervalHours,
        String cronExpression,

        // optional daily window, may wrap past midnight
        LocalTime windowStart,
        LocalTime windowEnd,

        // seconds; descriptive only
        int maxRuntime,
        List<BlackoutPeriod> blackoutPeriods,

        boolean retryOnFailure,
        int maxRetries,
        int retryDelayMinutes
) {
    public static final int DEFAULT_MAX_RUNTIME = 14_400;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_RETRY_DELAY_MINUTES = 30;

    public BackupSchedule {
        Objects.requireNonNull(type, "type must not be null");
        blackoutPeriods = blackoutPeriods == null ? List.of() : List.copyOf(blackoutPeriods);
    }

    /**
     * Zone of this schedule. Unknown ids fall back to UTC.
     */
    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            return ZoneOffset.UTC;
        }
    }

    public boolean isActiveOn(DayOfWeek day) {
        if (weekdays == null || day == null) {
            return false;
        }
        return (weekdays & (1 << (day.getValue() - 1))) != 0;
    }

    public Set<DayOfWeek> selectedWeekdays() {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (DayOfWeek d : DayOfWeek.values()) {
            if (isActiveOn(d)) {
                days.add(d);
            }
        }
        return days;
    }

    /**
     * Selected month days in ascending order.
     */
    public List<Integer> selectedMonthDays() {
        List<Integer> days = new ArrayList<>();
        if (monthdays == null) {
            return days;
        }
        for (int day = 1; day <= 31; day++) {
            if ((monthdays & (1 << (day - 1))) != 0) {
                days.add(day);
            }
        }
        return days;
    }

    /**
     * True when no window is configured, or the local clock time of {@code instant} lies inside it.
     * A window whose end is before its start wraps past midnight.
     */
    public boolean isWithinWindow(Instant instant) {
        if (windowStart == null || windowEnd == null) {
            return true;
        }
        LocalTime t = instant.atZone(zone()).toLocalTime();
        if (windowEnd.isBefore(windowStart)) {
            return !t.isBefore(windowStart) || !t.isAfter(windowEnd);
        }
        return !t.isBefore(windowStart) && !t.isAfter(windowEnd);
    }

    public boolean isInBlackout(Instant instant) {
        for (BlackoutPeriod period : blackoutPeriods) {
            if (period.contains(instant)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Human-readable summary, e.g. "Weekly on Monday, Friday at 02:00".
     */
    public String description() {
        return switch (type) {
            case INTERVAL -> "Every " + intervalHours + " hours";
            case DAILY -> "Daily at " + time;
            case WEEKLY -> "Weekly on " + selectedWeekdays().stream()
                    .map(d -> d.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                    .collect(Collectors.joining(", ")) + " at " + time;
            case MONTHLY -> "Monthly on days " + selectedMonthDays().stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", ")) + " at " + time;
            case CRON -> "Cron: " + cronExpression;
            case ADVANCED -> "Advanced schedule";
        };
    }

    public static int weekdayMask(DayOfWeek... days) {
        int mask = 0;
        for (DayOfWeek d : days) {
            mask |= 1 << (d.getValue() - 1);
        }
        return mask;
    }

    public static int monthdayMask(int... days) {
        int mask = 0;
        for (int d : days) {
            if (d < 1 || d > 31) {
                throw new IllegalArgumentException("month day out of range: " + d);
            }
            mask |= 1 << (d - 1);
        }
        return mask;
    }

    public static Builder builder(ScheduleType type) {
        return new Builder(type);
    }

    public Builder toBuilder() {
        return new Builder(type)
                .id(id)
                .targetId(targetId)
                .time(time)
                .timezone(timezone)
                .weekdays(weekdays)
                .monthdays(monthdays)
                .intervalHours(intervalHours)
                .cronExpression(cronExpression)
                .window(windowStart, windowEnd)
                .maxRuntime(maxRuntime)
                .blackoutPeriods(blackoutPeriods)
                .retry(retryOnFailure, maxRetries, retryDelayMinutes);
    }

    public static final class Builder {
        private final ScheduleType type;
        private long id;
        private long targetId;
        private LocalTime time;
        private String timezone = "UTC";
        private Integer weekdays;
        private Integer monthdays;
        private Integer intervalHours;
        private String cronExpression;
        private LocalTime windowStart;
        private LocalTime windowEnd;
        private int maxRuntime = DEFAULT_MAX_RUNTIME;
        private final List<BlackoutPeriod> blackoutPeriods = new ArrayList<>();
        private boolean retryOnFailure = true;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int retryDelayMinutes = DEFAULT_RETRY_DELAY_MINUTES;

        private Builder(ScheduleType type) {
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder targetId(long targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder time(LocalTime time) {
            this.time = time;
            return this;
        }

        public Builder time(String time) {
            this.time = time == null ? null : LocalTime.parse(time);
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder weekdays(Integer weekdays) {
            this.weekdays = weekdays;
            return this;
        }

        public Builder weekdays(DayOfWeek... days) {
            this.weekdays = weekdayMask(days);
            return this;
        }

        public Builder monthdays(Integer monthdays) {
            this.monthdays = monthdays;
            return this;
        }

        public Builder intervalHours(Integer intervalHours) {
            this.intervalHours = intervalHours;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder window(LocalTime start, LocalTime end) {
            this.windowStart = start;
            this.windowEnd = end;
            return this;
        }

        public Builder maxRuntime(int maxRuntime) {
            this.maxRuntime = maxRuntime;
            return this;
        }

        public Builder blackout(Instant start, Instant end) {
            this.blackoutPeriods.add(new BlackoutPeriod(start, end));
            return this;
        }

        public Builder blackoutPeriods(List<BlackoutPeriod> periods) {
            this.blackoutPeriods.clear();
            if (periods != null) {
                this.blackoutPeriods.addAll(periods);
            }
            return this;
        }

        public Builder retry(boolean retryOnFailure, int maxRetries, int retryDelayMinutes) {
            this.retryOnFailure = retryOnFailure;
            this.maxRetries = maxRetries;
            this.retryDelayMinutes = retryDelayMinutes;
            return this;
        }

        public BackupSchedule build() {
            return new BackupSchedule(
                    id,
                    targetId,
                    type,
                    time,
                    timezone,
                    weekdays,
                    monthdays,
                    intervalHours,
                    cronExpression,
                    windowStart,
                    windowEnd,
                    maxRuntime,
                    blackoutPeriods,
                    retryOnFailure,
                    maxRetries,
                    retryDelayMinutes
            );
        }
    }
}
