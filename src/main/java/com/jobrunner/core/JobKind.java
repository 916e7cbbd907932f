package com.jobrunner.core;

/**
 * How a job is triggered.
 */
public enum JobKind {
    /** Run on request by a user or on a schedule. */
    STANDARD,
    /** Run automatically when a matching object change is recorded. */
    HOOK_RECEIVER,
    /** Run when a user presses a button shown on an object. */
    BUTTON_RECEIVER
}
