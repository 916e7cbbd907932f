package com.jobrunner.core;

/**
 * Signal that ends a job run with {@link JobStatus#FAILURE}.
 *
 * <p>Job bodies normally return {@code context.logFailure(...)}. Helper code deep in a
 * call stack, where returning an outcome is awkward, may throw this instead; the executor
 * records the message as a failure entry and the result ends as FAILURE rather than ERRORED.</p>
 */
public class JobFailedException extends RuntimeException {

    public JobFailedException(String message) {
        super(message);
    }

    public JobFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
