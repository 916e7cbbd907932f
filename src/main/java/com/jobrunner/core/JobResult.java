package com.jobrunner.core;

import java.time.Instant;

/**
 * Durable record of one execution, persisted in {@code job_results}.
 *
 * <p>The id is the task id handed out by the task queue, so a caller holding the task id
 * can poll for the outcome. The row is created when a worker picks the task up, not when
 * it is enqueued.</p>
 */
public class JobResult {
    private String id;
    private String classPath;
    private String jobName;
    private JobStatus status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String userName;
    private String taskKwargs;
    private String resultJson;
    private String scheduledJobId;

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getClassPath() { return classPath; }
    public void setClassPath(String classPath) { this.classPath = classPath; }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    /**
     * Serialized input as JSON, or null when the job declares sensitive variables.
     */
    public String getTaskKwargs() { return taskKwargs; }
    public void setTaskKwargs(String taskKwargs) { this.taskKwargs = taskKwargs; }

    /**
     * JSON-encoded return value of a successful run.
     */
    public String getResultJson() { return resultJson; }
    public void setResultJson(String resultJson) { this.resultJson = resultJson; }

    public String getScheduledJobId() { return scheduledJobId; }
    public void setScheduledJobId(String scheduledJobId) { this.scheduledJobId = scheduledJobId; }

    @Override
    public String toString() {
        return "JobResult{id='" + id + "', classPath='" + classPath + "', status=" + status + "}";
    }
}
