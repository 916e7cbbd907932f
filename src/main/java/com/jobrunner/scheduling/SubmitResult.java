package com.jobrunner.scheduling;

/**
 * What {@link JobScheduler#submit} produced: a task id for an enqueued run, a
 * {@link ScheduledJob} for a deferred, recurring or approval-pending one.
 */
public class SubmitResult {
    private final ScheduledJob scheduledJob;
    private final String taskId;

    private SubmitResult(ScheduledJob scheduledJob, String taskId) {
        this.scheduledJob = scheduledJob;
        this.taskId = taskId;
    }

    public static SubmitResult enqueued(String taskId) {
        return new SubmitResult(null, taskId);
    }

    public static SubmitResult scheduled(ScheduledJob scheduledJob) {
        return new SubmitResult(scheduledJob, null);
    }

    /**
     * The persisted schedule, or null if the job was enqueued straight away.
     */
    public ScheduledJob getScheduledJob() {
        return scheduledJob;
    }

    /**
     * The task id, or null if nothing was enqueued yet.
     */
    public String getTaskId() {
        return taskId;
    }

    public boolean isEnqueued() {
        return taskId != null;
    }

    @Override
    public String toString() {
        return isEnqueued() ? "SubmitResult{taskId='" + taskId + "'}" : "SubmitResult{scheduledJob=" + scheduledJob + "}";
    }
}
