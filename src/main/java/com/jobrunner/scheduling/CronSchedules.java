package com.jobrunner.scheduling;

import com.asahaf.javacron.InvalidExpressionException;
import com.asahaf.javacron.Schedule;
import com.jobrunner.core.ValidationException;

import java.time.Instant;
import java.util.Date;

/**
 * Crontab handling for {@link JobExecutionType#CUSTOM} schedules.
 */
public final class CronSchedules {

    public static final String FIELD = "crontab";

    private CronSchedules() {
    }

    /**
     * Parse a crontab expression.
     *
     * @throws ValidationException on {@code crontab} if the expression is missing or malformed
     */
    public static Schedule parse(String crontab) throws ValidationException {
        if (crontab == null || crontab.isBlank()) {
            throw new ValidationException(FIELD, "Please enter a valid crontab.");
        }
        try {
            return Schedule.create(crontab.trim());
        } catch (InvalidExpressionException e) {
            throw new ValidationException(FIELD, "Invalid crontab \"" + crontab + "\": " + e.getMessage());
        }
    }

    /**
     * First fire time strictly after {@code after}.
     */
    public static Instant nextFire(String crontab, Instant after) throws ValidationException {
        return parse(crontab).next(Date.from(after)).toInstant();
    }
}
