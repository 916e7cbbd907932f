package com.jobrunner.scheduling;

import java.time.Instant;

/**
 * A persisted future, recurring or approval-pending run request, stored in {@code scheduled_jobs}.
 *
 * <p>The ticker enqueues it with its stored kwargs once {@code nextRun} has passed, provided
 * it is enabled and, if approval is required, approved. One-off schedules are deleted after
 * they fire; recurring ones move {@code nextRun} forward.</p>
 */
public class ScheduledJob {
    private String id;
    private String name;
    private String userName;
    private String classPath;
    private String taskQueue;
    private JobExecutionType interval;
    private String crontab;
    private Instant startTime;
    private Instant nextRun;
    private Instant lastRun;
    private int totalRunCount;
    private String taskKwargs;
    private boolean approvalRequired;
    private String approvedBy;
    private Instant approvedAt;
    private boolean enabled = true;

    /**
     * Whether the schedule may fire: no approval needed, or approval given.
     */
    public boolean isApproved() {
        return !approvalRequired || approvedAt != null;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public String getClassPath() { return classPath; }
    public void setClassPath(String classPath) { this.classPath = classPath; }

    public String getTaskQueue() { return taskQueue; }
    public void setTaskQueue(String taskQueue) { this.taskQueue = taskQueue; }

    public JobExecutionType getInterval() { return interval; }
    public void setInterval(JobExecutionType interval) { this.interval = interval; }

    public String getCrontab() { return crontab; }
    public void setCrontab(String crontab) { this.crontab = crontab; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public Instant getNextRun() { return nextRun; }
    public void setNextRun(Instant nextRun) { this.nextRun = nextRun; }

    public Instant getLastRun() { return lastRun; }
    public void setLastRun(Instant lastRun) { this.lastRun = lastRun; }

    public int getTotalRunCount() { return totalRunCount; }
    public void setTotalRunCount(int totalRunCount) { this.totalRunCount = totalRunCount; }

    public String getTaskKwargs() { return taskKwargs; }
    public void setTaskKwargs(String taskKwargs) { this.taskKwargs = taskKwargs; }

    public boolean isApprovalRequired() { return approvalRequired; }
    public void setApprovalRequired(boolean approvalRequired) { this.approvalRequired = approvalRequired; }

    public String getApprovedBy() { return approvedBy; }
    public void setApprovedBy(String approvedBy) { this.approvedBy = approvedBy; }

    public Instant getApprovedAt() { return approvedAt; }
    public void setApprovedAt(Instant approvedAt) { this.approvedAt = approvedAt; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Override
    public String toString() {
        return "ScheduledJob{id='" + id + "', name='" + name + "', classPath='" + classPath +
                "', interval=" + interval + ", nextRun=" + nextRun + "}";
    }
}
