package com.jobrunner.core;

import java.time.Instant;

/**
 * One line of a job's structured log, persisted in {@code job_log_entries}.
 */
public class JobLogEntry {
    private long id;
    private String jobResultId;
    private Instant loggedAt;
    private LogLevel level;
    private String grouping;
    private String message;
    private String objectType;
    private String objectId;
    private String objectDisplay;

    public JobLogEntry() {
    }

    public JobLogEntry(String jobResultId, LogLevel level, String grouping, String message, DomainObject object) {
        this.jobResultId = jobResultId;
        this.loggedAt = Instant.now();
        this.level = level;
        this.grouping = grouping;
        this.message = message;
        if (object != null) {
            this.objectType = object.getObjectType();
            this.objectId = object.getId();
            this.objectDisplay = object.getDisplay();
        }
    }

    // Getters and Setters
    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getJobResultId() { return jobResultId; }
    public void setJobResultId(String jobResultId) { this.jobResultId = jobResultId; }

    public Instant getLoggedAt() { return loggedAt; }
    public void setLoggedAt(Instant loggedAt) { this.loggedAt = loggedAt; }

    public LogLevel getLevel() { return level; }
    public void setLevel(LogLevel level) { this.level = level; }

    public String getGrouping() { return grouping; }
    public void setGrouping(String grouping) { this.grouping = grouping; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getObjectType() { return objectType; }
    public void setObjectType(String objectType) { this.objectType = objectType; }

    public String getObjectId() { return objectId; }
    public void setObjectId(String objectId) { this.objectId = objectId; }

    public String getObjectDisplay() { return objectDisplay; }
    public void setObjectDisplay(String objectDisplay) { this.objectDisplay = objectDisplay; }

    @Override
    public String toString() {
        return "JobLogEntry{" + level + " [" + grouping + "] " + message + "}";
    }
}
