package com.jobrunner.scheduling;

import java.time.Instant;

/**
 * Schedule part of a run request: a name, the interval, a start time and, for
 * {@link JobExecutionType#CUSTOM}, a crontab expression.
 */
public class ScheduleSpec {
    private final String name;
    private final JobExecutionType interval;
    private final Instant startTime;
    private final String crontab;

    public ScheduleSpec(String name, JobExecutionType interval, Instant startTime, String crontab) {
        this.name = name;
        this.interval = interval == null ? JobExecutionType.IMMEDIATELY : interval;
        this.startTime = startTime;
        this.crontab = crontab;
    }

    public static ScheduleSpec immediately() {
        return new ScheduleSpec(null, JobExecutionType.IMMEDIATELY, null, null);
    }

    public static ScheduleSpec at(String name, Instant startTime) {
        return new ScheduleSpec(name, JobExecutionType.FUTURE, startTime, null);
    }

    public static ScheduleSpec every(String name, JobExecutionType interval, Instant startTime) {
        return new ScheduleSpec(name, interval, startTime, null);
    }

    public static ScheduleSpec cron(String name, String crontab) {
        return new ScheduleSpec(name, JobExecutionType.CUSTOM, null, crontab);
    }

    public String getName() {
        return name;
    }

    public JobExecutionType getInterval() {
        return interval;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public String getCrontab() {
        return crontab;
    }
}
