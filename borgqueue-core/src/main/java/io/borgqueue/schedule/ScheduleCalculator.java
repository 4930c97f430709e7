package io.borgqueue.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Computes the next due timestamp of a {@link BackupSchedule}.
 * <p>
 * Supported types:
 * <ul>
 *   <li>interval: {@code from + intervalHours}</li>
 *   <li>daily: next {@code time} strictly after {@code from}, skipping blacked-out days</li>
 *   <li>weekly: next active weekday within two weeks, skipping blacked-out days</li>
 *   <li>monthly: next selected day of this month, else the first usable one of next month</li>
 * </ul>
 * <p>
 * Cron and advanced schedules are not calculated and always yield empty. A malformed schedule
 * also yields empty; this class never throws for schedule content, so one bad schedule cannot
 * stall the scheduler tick.
 * <p>
 * Window checks are not part of the calculation; the scheduler applies
 * {@link BackupSchedule#isWithinWindow(Instant)} at enqueue time.
 */
public final class ScheduleCalculator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCalculator.class);

    static final int WEEKLY_SCAN_DAYS = 14;
    static final int DAILY_BLACKOUT_SCAN_DAYS = 366;

    private ScheduleCalculator() {
    }

    public static Optional<Instant> nextRun(BackupSchedule schedule, Instant from) {
        if (schedule == null || from == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(compute(schedule, from));
        } catch (Exception e) {
            log.warn("schedule next run calculation failed scheduleId={} type={} msg={}",
                    schedule.id(), schedule.type(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Instant compute(BackupSchedule schedule, Instant from) {
        return switch (schedule.type()) {
            case INTERVAL -> interval(schedule, from);
            case DAILY -> daily(schedule, from);
            case WEEKLY -> weekly(schedule, from);
            case MONTHLY -> monthly(schedule, from);
            // TODO: decide cron semantics (Quartz vs. 5-field Unix) before computing cron runs
            case CRON, ADVANCED -> null;
        };
    }

    /* =========================================================
     * interval
     * ========================================================= */
    private static Instant interval(BackupSchedule schedule, Instant from) {
        Integer hours = schedule.intervalHours();
        if (hours == null || hours <= 0) {
            return null;
        }
        return from.plusSeconds(hours * 3600L);
    }

    /* =========================================================
     * daily
     * ========================================================= */
    private static Instant daily(BackupSchedule schedule, Instant from) {
        LocalTime time = schedule.time();
        if (time == null) {
            return null;
        }
        ZonedDateTime base = from.atZone(schedule.zone());
        ZonedDateTime candidate = atTime(base, time);
        if (!candidate.toInstant().isAfter(from)) {
            candidate = atTime(candidate.plusDays(1), time);
        }

        for (int i = 0; i < DAILY_BLACKOUT_SCAN_DAYS; i++) {
            if (!schedule.isInBlackout(candidate.toInstant())) {
                return candidate.toInstant();
            }
            candidate = atTime(candidate.plusDays(1), time);
        }
        return null;
    }

    /* =========================================================
     * weekly
     * ========================================================= */
    private static Instant weekly(BackupSchedule schedule, Instant from) {
        Integer mask = schedule.weekdays();
        LocalTime time = schedule.time();
        if (mask == null || (mask & 0x7F) == 0 || time == null) {
            return null;
        }

        ZonedDateTime candidate = atTime(from.atZone(schedule.zone()), time);

        for (int i = 0; i < WEEKLY_SCAN_DAYS; i++) {
            if (i > 0 || !candidate.toInstant().isAfter(from)) {
                candidate = atTime(candidate.plusDays(1), time);
            }
            if (schedule.isActiveOn(candidate.getDayOfWeek())
                    && candidate.toInstant().isAfter(from)
                    && !schedule.isInBlackout(candidate.toInstant())) {
                return candidate.toInstant();
            }
        }
        return null;
    }

    /* =========================================================
     * monthly
     * ========================================================= */
    private static Instant monthly(BackupSchedule schedule, Instant from) {
        List<Integer> days = schedule.selectedMonthDays();
        LocalTime time = schedule.time();
        if (days.isEmpty() || time == null) {
            return null;
        }

        ZoneId zone = schedule.zone();
        ZonedDateTime base = from.atZone(zone);
        int today = base.getDayOfMonth();
        YearMonth thisMonth = YearMonth.from(base);

        for (int day : days) {
            if (day < today || !thisMonth.isValidDay(day)) {
                continue;
            }
            ZonedDateTime candidate = thisMonth.atDay(day).atTime(time).atZone(zone);
            if (day == today && !candidate.toInstant().isAfter(from)) {
                continue;
            }
            if (!schedule.isInBlackout(candidate.toInstant())) {
                return candidate.toInstant();
            }
        }

        YearMonth nextMonth = thisMonth.plusMonths(1);
        for (int day : days) {
            if (!nextMonth.isValidDay(day)) {
                continue;
            }
            ZonedDateTime candidate = nextMonth.atDay(day).atTime(time).atZone(zone);
            if (!schedule.isInBlackout(candidate.toInstant())) {
                return candidate.toInstant();
            }
        }
        return null;
    }

    /* ================= helper ================= */

    // Re-anchors on the wall-clock time so DST shifts do not drift the schedule.
    private static ZonedDateTime atTime(ZonedDateTime day, LocalTime time) {
        return day.toLocalDate().atTime(time).atZone(day.getZone());
    }
}
