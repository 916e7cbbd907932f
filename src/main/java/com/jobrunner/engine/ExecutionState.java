package com.jobrunner.engine;

import com.jobrunner.core.JobStatus;

/**
 * Phases of one execution inside {@link JobExecutor}.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>CREATED → INITIALIZING: result row created, input about to be checked</li>
 *   <li>INITIALIZING → RUNNING: input deserialized, job body entered</li>
 *   <li>INITIALIZING → FAILURE | ERRORED: job unavailable, disabled or input unusable</li>
 *   <li>RUNNING → SUCCESS | FAILURE | ERRORED: outcome of the job body</li>
 * </ul>
 */
public enum ExecutionState {
    CREATED,
    INITIALIZING,
    RUNNING,
    SUCCESS,
    FAILURE,
    ERRORED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == ERRORED;
    }

    public boolean canTransitionTo(ExecutionState next) {
        return switch (this) {
            case CREATED -> next == INITIALIZING;
            case INITIALIZING -> next == RUNNING || next == FAILURE || next == ERRORED;
            case RUNNING -> next == SUCCESS || next == FAILURE || next == ERRORED;
            default -> false;
        };
    }

    /**
     * Move to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public ExecutionState transitionTo(ExecutionState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal execution state transition " + this + " -> " + next);
        }
        return next;
    }

    /**
     * Persisted status for a terminal state.
     */
    public JobStatus toJobStatus() {
        return switch (this) {
            case SUCCESS -> JobStatus.SUCCESS;
            case FAILURE -> JobStatus.FAILURE;
            case ERRORED -> JobStatus.ERRORED;
            default -> throw new IllegalStateException(this + " is not terminal");
        };
    }
}
