package com.jobrunner.changes;

/**
 * What caused a change to be made.
 */
public enum ChangeContextType {
    WEB("web"),
    JOB("job"),
    JOB_HOOK("job-hook"),
    ORM("orm"),
    UNKNOWN("unknown");

    private final String value;

    ChangeContextType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
