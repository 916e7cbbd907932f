package com.jobrunner.core;

/**
 * Persisted status of a {@link JobResult}.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RUNNING: input deserialized, job body about to run</li>
 *   <li>PENDING → FAILURE: job disabled or input could not be deserialized</li>
 *   <li>PENDING → ERRORED: worker killed the task before it started running</li>
 *   <li>RUNNING → SUCCESS: the job body returned a success outcome</li>
 *   <li>RUNNING → FAILURE: the job body signalled failure via logFailure</li>
 *   <li>RUNNING → ERRORED: the job body raised an unexpected exception or timed out</li>
 * </ul>
 *
 * <p>Terminal states are final: a result that reached SUCCESS, FAILURE or ERRORED
 * is never updated again except for reads.</p>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @see #canTransitionTo(JobStatus)
 * @author Job Queue Team
 */
public enum JobStatus {
    PENDING("Pending"),
    RUNNING("Running"),
    SUCCESS("Success"),
    FAILURE("Failure"),
    ERRORED("Errored");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this status.
     *
     * @return the display name (e.g., "Success", "Failure")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this status represents a terminal state.
     *
     * @return true if the result has reached SUCCESS, FAILURE or ERRORED
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == ERRORED;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed, false if it violates state machine rules
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RUNNING || newStatus == FAILURE || newStatus == ERRORED;
            case RUNNING -> newStatus == SUCCESS || newStatus == FAILURE || newStatus == ERRORED;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
