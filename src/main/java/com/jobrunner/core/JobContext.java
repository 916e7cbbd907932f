package com.jobrunner.core;

import com.jobrunner.db.JobResultRepository;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Execution environment handed to {@link Job#run(JobContext, java.util.Map)}.
 *
 * <p>This class is the bridge between a job's business logic and the executor. It provides:</p>
 * <ul>
 *   <li>Structured logging persisted as {@link JobLogEntry} rows</li>
 *   <li>The grouping (phase label) new entries are tagged with</li>
 *   <li>The cooperative soft time limit signal</li>
 *   <li>Access to the inventory through {@link ObjectRepository}</li>
 * </ul>
 *
 * <p><b>Persistence:</b> every entry is inserted immediately in its own statement so that
 * nothing is lost if the worker is killed at the hard time limit. A failed insert is reported
 * to the process log but never fails the job.</p>
 *
 * <p><b>Process log mirror:</b> every entry is also written to a {@link Logger} named after
 * the job's dotted class path, e.g. {@code local.backup.BackupConfigs}.</p>
 *
 * <p><b>Thread Safety:</b> a job body runs on a single thread, so appends are sequential.
 * The soft limit flag is set from the time-limit thread and uses an {@link AtomicBoolean}.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * for (DomainObject device : devices) {
 *     if (context.isSoftTimeLimitExceeded()) {
 *         context.logWarning("Out of time, stopping early");
 *         break;
 *     }
 *     context.logInfo(device, "Backed up");
 * }
 * }</pre>
 *
 * @author Job Queue Team
 */
public class JobContext {
    private static final Logger logger = Logger.getLogger(JobContext.class.getName());

    public static final String GROUPING_INITIALIZATION = "initialization";
    public static final String GROUPING_RUN = "run";
    public static final String GROUPING_CLEANUP = "cleanup";

    private final String jobResultId;
    private final ClassPath classPath;
    private final String user;
    private final JobResultRepository repository;
    private final ObjectRepository objectRepository;
    private final Logger jobLogger;
    private final AtomicBoolean softTimeLimitExceeded = new AtomicBoolean(false);
    private volatile String grouping = GROUPING_INITIALIZATION;

    /**
     * Create the context for one execution. Called by the executor at worker pickup.
     *
     * @param jobResultId id of the {@link JobResult} entries are attached to
     * @param classPath class path of the job being run
     * @param user user the run is attributed to
     * @param repository repository the log entries are written to
     * @param objectRepository inventory access for the job body
     */
    public JobContext(String jobResultId, ClassPath classPath, String user,
                      JobResultRepository repository, ObjectRepository objectRepository) {
        this.jobResultId = jobResultId;
        this.classPath = classPath;
        this.user = user;
        this.repository = repository;
        this.objectRepository = objectRepository;
        this.jobLogger = Logger.getLogger(classPath.toDotted());
    }

    public String getJobResultId() {
        return jobResultId;
    }

    public ClassPath getClassPath() {
        return classPath;
    }

    public String getUser() {
        return user;
    }

    public ObjectRepository getObjectRepository() {
        return objectRepository;
    }

    /**
     * Get the label new entries are tagged with.
     */
    public String getGrouping() {
        return grouping;
    }

    /**
     * Tag subsequent entries with a custom grouping, e.g. one per device being processed.
     */
    public void setGrouping(String grouping) {
        this.grouping = grouping;
    }

    /**
     * Append an entry to the job log.
     *
     * @param level severity of the entry
     * @param object the affected object, may be null
     * @param message the message
     */
    public void log(LogLevel level, DomainObject object, String message) {
        JobLogEntry entry = new JobLogEntry(jobResultId, level, grouping, message, object);
        if (object != null) {
            jobLogger.log(level.toJulLevel(), "[" + grouping + "] " + object.getDisplay() + ": " + message);
        } else {
            jobLogger.log(level.toJulLevel(), "[" + grouping + "] " + message);
        }
        try {
            repository.appendLogEntry(entry);
        } catch (SQLException e) {
            // Logging failures must not fail the job
            logger.log(Level.WARNING, "Failed to persist log entry for job result " + jobResultId, e);
        }
    }

    public void logDebug(String message) {
        log(LogLevel.DEFAULT, null, message);
    }

    public void logDebug(DomainObject object, String message) {
        log(LogLevel.DEFAULT, object, message);
    }

    public void logInfo(String message) {
        log(LogLevel.INFO, null, message);
    }

    public void logInfo(DomainObject object, String message) {
        log(LogLevel.INFO, object, message);
    }

    public void logSuccess(String message) {
        log(LogLevel.SUCCESS, null, message);
    }

    public void logSuccess(DomainObject object, String message) {
        log(LogLevel.SUCCESS, object, message);
    }

    public void logWarning(String message) {
        log(LogLevel.WARNING, null, message);
    }

    public void logWarning(DomainObject object, String message) {
        log(LogLevel.WARNING, object, message);
    }

    /**
     * Record a failure and produce the outcome that ends the run.
     *
     * <p>The entry is written before this method returns. The job body is expected to
     * return the result straight away:</p>
     * <pre>{@code
     * return context.logFailure("Device unreachable");
     * }</pre>
     *
     * @param message the failure message
     * @return a failure outcome carrying the message
     */
    public ExecutionOutcome logFailure(String message) {
        return logFailure(null, message);
    }

    public ExecutionOutcome logFailure(DomainObject object, String message) {
        log(LogLevel.FAILURE, object, message);
        return ExecutionOutcome.loggedFailure(message);
    }

    /**
     * Check whether the soft time limit has passed.
     *
     * @return true once the limit has been signalled
     */
    public boolean isSoftTimeLimitExceeded() {
        return softTimeLimitExceeded.get();
    }

    /**
     * Throw if the soft time limit has passed.
     *
     * <p>Jobs that have nothing to wrap up can call this between steps and let the
     * exception end the run as errored.</p>
     *
     * @throws SoftTimeLimitExceededException if the limit has been signalled
     */
    public void throwIfSoftTimeLimitExceeded() throws SoftTimeLimitExceededException {
        if (softTimeLimitExceeded.get()) {
            throw new SoftTimeLimitExceededException("Soft time limit exceeded for " + classPath);
        }
    }

    /**
     * Raise the soft time limit flag. Called by the task queue, not by jobs.
     */
    public void signalSoftTimeLimit() {
        softTimeLimitExceeded.set(true);
    }

    @Override
    public String toString() {
        return "JobContext{" +
                "jobResultId='" + jobResultId + '\'' +
                ", classPath=" + classPath +
                ", grouping='" + grouping + '\'' +
                '}';
    }
}
