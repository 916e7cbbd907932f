package com.jobrunner.core;

/**
 * Thrown by {@link JobContext#throwIfSoftTimeLimitExceeded()} once the task queue has
 * signalled the soft time limit. Jobs may catch it to wrap up; if it escapes {@code run}
 * the result ends as {@link JobStatus#ERRORED}.
 */
public class SoftTimeLimitExceededException extends Exception {

    public SoftTimeLimitExceededException(String message) {
        super(message);
    }
}
