package io.borgqueue.schedule;

import org.quartz.CronExpression;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a schedule definition before it is stored.
 */
public final class ScheduleValidator {

    private ScheduleValidator() {
    }

    /**
     * @return problems found; empty when the schedule is usable
     */
    public static List<String> validate(BackupSchedule schedule) {
        List<String> problems = new ArrayList<>();
        if (schedule == null) {
            problems.add("schedule must not be null");
            return problems;
        }

        switch (schedule.type()) {
            case INTERVAL -> {
                if (schedule.intervalHours() == null || schedule.intervalHours() <= 0) {
                    problems.add("interval_hours must be a positive number for interval schedules");
                }
            }
            case DAILY -> requireTime(schedule, problems);
            case WEEKLY -> {
                requireTime(schedule, problems);
                if (schedule.weekdays() == null || (schedule.weekdays() & 0x7F) == 0) {
                    problems.add("at least one weekday must be selected for weekly schedules");
                }
            }
            case MONTHLY -> {
                requireTime(schedule, problems);
                if (schedule.monthdays() == null || schedule.monthdays() == 0) {
                    problems.add("at least one month day must be selected for monthly schedules");
                }
            }
            case CRON -> {
                String cron = schedule.cronExpression();
                if (cron == null || cron.isBlank()) {
                    problems.add("cron_expression is required for cron schedules");
                } else if (!looksLikeCron(cron)) {
                    problems.add("cron_expression is not a valid cron expression: " + cron);
                }
            }
            case ADVANCED -> {
            }
        }

        if (schedule.timezone() != null && !schedule.timezone().isBlank()) {
            try {
                ZoneId.of(schedule.timezone());
            } catch (Exception e) {
                problems.add("unknown timezone: " + schedule.timezone());
            }
        }

        if ((schedule.windowStart() == null) != (schedule.windowEnd() == null)) {
            problems.add("window_start and window_end must be set together");
        }

        for (BlackoutPeriod period : schedule.blackoutPeriods()) {
            if (period.end().isBefore(period.start())) {
                problems.add("blackout period ends before it starts: " + period.start() + " > " + period.end());
            }
        }

        if (schedule.maxRuntime() <= 0) {
            problems.add("max_runtime must be positive");
        }
        if (schedule.maxRetries() < 0) {
            problems.add("max_retries must not be negative");
        }
        if (schedule.retryDelayMinutes() < 0) {
            problems.add("retry_delay_minutes must not be negative");
        }
        return problems;
    }

    public static BackupSchedule requireValid(BackupSchedule schedule) {
        List<String> problems = validate(schedule);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid schedule: " + String.join("; ", problems));
        }
        return schedule;
    }

    /**
     * Accepts 5-field Unix cron (seconds are prepended) and 6/7-field Quartz cron.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    static String normalizeCron(String spec) {
        String s = spec.trim();
        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    // Quartz requires '?' in one of the two day fields.
    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static void requireTime(BackupSchedule schedule, List<String> problems) {
        if (schedule.time() == null) {
            problems.add("time is required for " + schedule.type().value() + " schedules");
        }
    }
}
