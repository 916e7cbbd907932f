package com.jobrunner.core;

/**
 * Exception thrown when a job is submitted or run while its {@link JobModel} is disabled.
 */
public class JobDisabledException extends Exception {

    private final String classPath;

    public JobDisabledException(String classPath) {
        super("Job " + classPath + " is not enabled to be run!");
        this.classPath = classPath;
    }

    public String getClassPath() {
        return classPath;
    }
}
