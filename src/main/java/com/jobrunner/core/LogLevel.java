package com.jobrunner.core;

import java.util.logging.Level;

/**
 * Severity of a {@link JobLogEntry}.
 */
public enum LogLevel {
    DEFAULT("default", Level.FINE),
    INFO("info", Level.INFO),
    SUCCESS("success", Level.INFO),
    WARNING("warning", Level.WARNING),
    FAILURE("failure", Level.SEVERE);

    private final String value;
    private final Level julLevel;

    LogLevel(String value, Level julLevel) {
        this.value = value;
        this.julLevel = julLevel;
    }

    public String getValue() {
        return value;
    }

    /**
     * Level used when the entry is mirrored to the process log.
     */
    public Level toJulLevel() {
        return julLevel;
    }

    public static LogLevel fromValue(String value) {
        for (LogLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level: " + value);
    }
}
