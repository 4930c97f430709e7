package io.borgqueue.internal.mongo;

import io.borgqueue.schedule.BackupSchedule;
import io.borgqueue.schedule.BlackoutPeriod;
import io.borgqueue.schedule.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Mongo document model for backup schedules. {@code jobId} references the
 * {@link BackupTargetDocument} the schedule belongs to.
 *
 * <p>Times of day are stored as {@code HH:mm[:ss]} strings in the schedule's own timezone.
 */
@Document(collection = "backup_schedules")
public class BackupScheduleDocument {

    @Id
    private Long id;

    private Long jobId;
    private String type;
    private String time;
    private String timezone;
    private Integer weekdays;
    private Integer monthdays;
    private Integer intervalHours;
    private String cronExpression;
    private String windowStart;
    private String windowEnd;
    private int maxRuntime = BackupSchedule.DEFAULT_MAX_RUNTIME;
    private List<Blackout> blackoutPeriods = new ArrayList<>();
    private boolean retryOnFailure = true;
    private int maxRetries = BackupSchedule.DEFAULT_MAX_RETRIES;
    private int retryDelayMinutes = BackupSchedule.DEFAULT_RETRY_DELAY_MINUTES;

    public BackupScheduleDocument() {
    }

    public static BackupScheduleDocument from(BackupSchedule schedule) {
        BackupScheduleDocument doc = new BackupScheduleDocument();
        doc.setId(schedule.id());
        doc.setJobId(schedule.targetId());
        doc.setType(schedule.type().value());
        doc.setTime(format(schedule.time()));
        doc.setTimezone(schedule.timezone());
        doc.setWeekdays(schedule.weekdays());
        doc.setMonthdays(schedule.monthdays());
        doc.setIntervalHours(schedule.intervalHours());
        doc.setCronExpression(schedule.cronExpression());
        doc.setWindowStart(format(schedule.windowStart()));
        doc.setWindowEnd(format(schedule.windowEnd()));
        doc.setMaxRuntime(schedule.maxRuntime());
        List<Blackout> blackouts = new ArrayList<>();
        for (BlackoutPeriod p : schedule.blackoutPeriods()) {
            blackouts.add(new Blackout(p.start(), p.end()));
        }
        doc.setBlackoutPeriods(blackouts);
        doc.setRetryOnFailure(schedule.retryOnFailure());
        doc.setMaxRetries(schedule.maxRetries());
        doc.setRetryDelayMinutes(schedule.retryDelayMinutes());
        return doc;
    }

    public BackupSchedule toSchedule() {
        List<BlackoutPeriod> periods = new ArrayList<>();
        if (blackoutPeriods != null) {
            for (Blackout b : blackoutPeriods) {
                if (b != null && b.getStart() != null && b.getEnd() != null) {
                    periods.add(new BlackoutPeriod(b.getStart(), b.getEnd()));
                }
            }
        }
        return BackupSchedule.builder(ScheduleType.fromValue(type))
                .id(id)
                .targetId(jobId != null ? jobId : 0L)
                .time(parse(time))
                .timezone(timezone)
                .weekdays(weekdays)
                .monthdays(monthdays)
                .intervalHours(intervalHours)
                .cronExpression(cronExpression)
                .window(parse(windowStart), parse(windowEnd))
                .maxRuntime(maxRuntime)
                .blackoutPeriods(periods)
                .retry(retryOnFailure, maxRetries, retryDelayMinutes)
                .build();
    }

    private static String format(LocalTime t) {
        return t == null ? null : t.toString();
    }

    private static LocalTime parse(String s) {
        return s == null || s.isBlank() ? null : LocalTime.parse(s);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getJobId() {
        return jobId;
    }

    public void setJobId(Long jobId) {
        this.jobId = jobId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTime() {
        return time;
    }

    public void setTime(String time) {
        this.time = time;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Integer getWeekdays() {
        return weekdays;
    }

    public void setWeekdays(Integer weekdays) {
        this.weekdays = weekdays;
    }

    public Integer getMonthdays() {
        return monthdays;
    }

    public void setMonthdays(Integer monthdays) {
        this.monthdays = monthdays;
    }

    public Integer getIntervalHours() {
        return intervalHours;
    }

    public void setIntervalHours(Integer intervalHours) {
        this.intervalHours = intervalHours;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(String windowStart) {
        this.windowStart = windowStart;
    }

    public String getWindowEnd() {
        return windowEnd;
    }

    public void setWindowEnd(String windowEnd) {
        this.windowEnd = windowEnd;
    }

    public int getMaxRuntime() {
        return maxRuntime;
    }

    public void setMaxRuntime(int maxRuntime) {
        this.maxRuntime = maxRuntime;
    }

    public List<Blackout> getBlackoutPeriods() {
        return blackoutPeriods;
    }

    public void setBlackoutPeriods(List<Blackout> blackoutPeriods) {
        this.blackoutPeriods = blackoutPeriods;
    }

    public boolean isRetryOnFailure() {
        return retryOnFailure;
    }

    public void setRetryOnFailure(boolean retryOnFailure) {
        this.retryOnFailure = retryOnFailure;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryDelayMinutes() {
        return retryDelayMinutes;
    }

    public void setRetryDelayMinutes(int retryDelayMinutes) {
        this.retryDelayMinutes = retryDelayMinutes;
    }

    public static class Blackout {
        private Instant start;
        private Instant end;

        public Blackout() {
        }

        public Blackout(Instant start, Instant end) {
            this.start = start;
            this.end = end;
        }

        public Instant getStart() {
            return start;
        }

        public void setStart(Instant start) {
            this.start = start;
        }

        public Instant getEnd() {
            return end;
        }

        public void setEnd(Instant end) {
            this.end = end;
        }
    }
}
