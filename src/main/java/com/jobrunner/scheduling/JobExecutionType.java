package com.jobrunner.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * When and how often a submitted job runs.
 */
public enum JobExecutionType {
    IMMEDIATELY("immediately", null),
    FUTURE("future", null),
    HOURLY("hourly", Duration.ofHours(1)),
    DAILY("daily", Duration.ofDays(1)),
    WEEKLY("weekly", Duration.ofDays(7)),
    CUSTOM("custom", null);

    private final String value;
    private final Duration period;

    JobExecutionType(String value, Duration period) {
        this.value = value;
        this.period = period;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether a schedule of this type fires more than once.
     */
    public boolean isRecurring() {
        return period != null || this == CUSTOM;
    }

    /**
     * Next fire time of a fixed-period schedule.
     *
     * @throws IllegalStateException for types without a fixed period
     */
    public Instant nextAfter(Instant previous) {
        if (period == null) {
            throw new IllegalStateException(name() + " has no fixed period");
        }
        return previous.plus(period);
    }

    public static JobExecutionType fromValue(String value) {
        for (JobExecutionType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown interval: " + value);
    }
}
