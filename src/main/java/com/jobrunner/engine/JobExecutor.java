package com.jobrunner.engine;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.jobrunner.changes.ChangeContext;
import com.jobrunner.changes.ChangeLogging;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.Job;
import com.jobrunner.core.JobContext;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobFailedException;
import com.jobrunner.core.JobKind;
import com.jobrunner.core.JobKwargs;
import com.jobrunner.core.JobLogEntry;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.JobResult;
import com.jobrunner.core.JobStatus;
import com.jobrunner.core.LogLevel;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.JobModelRepository;
import com.jobrunner.db.JobResultRepository;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.vars.JobVariable;
import com.jobrunner.vars.VariableServices;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one queued task from pickup to terminal status.
 *
 * <p><b>Lifecycle:</b></p>
 * <ol>
 *   <li>created: the {@link JobResult} row is inserted as PENDING under the task id</li>
 *   <li>initializing: the job and its model are resolved, the enabled flag and time limits
 *       are checked and the stored input is deserialized</li>
 *   <li>running: the job body runs inside a change-logging scope attributed to the run</li>
 *   <li>cleanup: uploaded files referenced by the input are deleted and "Job completed" is
 *       logged, whatever happened before</li>
 * </ol>
 *
 * <p>The terminal status is written once, after cleanup. Job-body problems never escape this
 * class: they become a FAILURE or ERRORED result plus a log entry. Only database errors on the
 * result row itself are thrown to the worker.</p>
 *
 * <p><b>Thread Safety:</b> one instance serves every worker thread. Executions share no
 * mutable state apart from the registry of active contexts used for time limit signals.</p>
 *
 * @author Job Queue Team
 * @see ExecutionState
 * @see ExecutorTaskQueue
 */
public class JobExecutor {
    private static final Logger logger = Logger.getLogger(JobExecutor.class.getName());

    private static final Gson gson = new GsonBuilder().serializeNulls().create();

    private final JobDiscovery discovery;
    private final JobModelRepository modelRepository;
    private final JobResultRepository resultRepository;
    private final VariableServices services;
    private final Clock clock;
    private final Duration defaultSoftTimeLimit;
    private final Duration defaultTimeLimit;
    private final Map<String, JobContext> activeContexts = new ConcurrentHashMap<>();

    public JobExecutor(JobDiscovery discovery, JobModelRepository modelRepository, JobResultRepository resultRepository,
                       VariableServices services, Clock clock, Duration defaultSoftTimeLimit, Duration defaultTimeLimit) {
        this.discovery = discovery;
        this.modelRepository = modelRepository;
        this.resultRepository = resultRepository;
        this.services = services;
        this.clock = clock;
        this.defaultSoftTimeLimit = defaultSoftTimeLimit;
        this.defaultTimeLimit = defaultTimeLimit;
    }

    /**
     * Execute a task and return its final result.
     *
     * @param task the task picked up by a worker
     * @return the stored result after the terminal status was written
     * @throws SQLException if the result row cannot be created or read back
     */
    public JobResult execute(QueuedTask task) throws SQLException {
        String taskId = task.getTaskId();
        ExecutionState state = ExecutionState.CREATED;

        Optional<ClassPath> parsed = ClassPath.tryParse(task.getClassPath());
        JobDefinition definition = parsed.isPresent() ? discovery.getJob(task.getClassPath()) : null;
        createResult(task, definition);

        if (parsed.isEmpty()) {
            // Without a class path there is no job logger to mirror to
            state = state.transitionTo(ExecutionState.INITIALIZING).transitionTo(ExecutionState.FAILURE);
            resultRepository.appendLogEntry(new JobLogEntry(taskId, LogLevel.FAILURE,
                    JobContext.GROUPING_INITIALIZATION, "Invalid class_path value \"" + task.getClassPath() + "\"", null));
            return complete(taskId, state, null);
        }

        JobContext context = new JobContext(taskId, parsed.get(), task.getUser(), resultRepository,
                services.getObjectRepository());
        activeContexts.put(taskId, context);
        Object returnValue = null;
        Error fatal = null;
        try {
            state = state.transitionTo(ExecutionState.INITIALIZING);
            Map<String, Object> data = null;
            if (definition == null) {
                context.logFailure("Job " + task.getClassPath() + " is not available");
                state = state.transitionTo(ExecutionState.FAILURE);
            } else {
                try {
                    data = initialize(context, definition, task);
                    if (data == null) {
                        state = state.transitionTo(ExecutionState.FAILURE);
                    }
                } catch (SQLException e) {
                    logger.log(Level.SEVERE, "Database error while initializing " + taskId, e);
                    context.log(LogLevel.FAILURE, null, "Error initializing job:\n" + ExecutionOutcome.stackTraceOf(e));
                    state = state.transitionTo(ExecutionState.ERRORED);
                }
            }

            if (data != null) {
                state = state.transitionTo(ExecutionState.RUNNING);
                ExecutionOutcome outcome = run(context, definition, task, data);
                switch (outcome.getKind()) {
                    case SUCCESS -> {
                        returnValue = outcome.getValue();
                        state = state.transitionTo(ExecutionState.SUCCESS);
                    }
                    case FAILURE -> {
                        if (!outcome.isLogged()) {
                            context.log(LogLevel.FAILURE, null, outcome.getMessage());
                        }
                        state = state.transitionTo(ExecutionState.FAILURE);
                    }
                    case ERROR -> {
                        context.log(LogLevel.FAILURE, null, outcome.getTrace() != null
                                ? "An exception occurred: " + outcome.getTrace()
                                : outcome.getMessage());
                        state = state.transitionTo(ExecutionState.ERRORED);
                    }
                }
            }
        } catch (Error e) {
            logger.log(Level.SEVERE, "Fatal error while executing task " + taskId, e);
            context.log(LogLevel.FAILURE, null, "An exception occurred: " + ExecutionOutcome.stackTraceOf(e));
            state = toErrored(state);
            fatal = e;
        } finally {
            cleanup(context, definition != null ? definition.getFileVariableNames() : task.getFileVariables(), task);
            context.logInfo("Job completed");
            activeContexts.remove(taskId);
        }

        JobResult result = complete(taskId, state, returnValue);
        if (fatal instanceof VirtualMachineError) {
            throw fatal;
        }
        return result;
    }

    private static ExecutionState toErrored(ExecutionState state) {
        if (state.isTerminal()) {
            return state;
        }
        if (state == ExecutionState.CREATED) {
            state = state.transitionTo(ExecutionState.INITIALIZING);
        }
        return state.transitionTo(ExecutionState.ERRORED);
    }

    /**
     * Resolve policy and input for the run.
     *
     * @return the deserialized input, or null if the run must stop with a failure
     */
    private Map<String, Object> initialize(JobContext context, JobDefinition definition, QueuedTask task)
            throws SQLException {
        ClassPath classPath = definition.getClassPath();
        JobModel model = modelRepository.findByClassPath(classPath);
        if (model == null || !model.isInstalled()) {
            context.logFailure("Unable to find a job model for " + classPath);
            return null;
        }
        if (!model.isEnabled()) {
            context.logFailure("Job " + model.getName() + " is not enabled to be run!");
            return null;
        }

        Duration softLimit = orDefault(task.getSoftTimeLimit(), orDefault(model.getSoftTimeLimit(), defaultSoftTimeLimit));
        Duration hardLimit = orDefault(task.getTimeLimit(), orDefault(model.getTimeLimit(), defaultTimeLimit));
        if (hardLimit.compareTo(softLimit) <= 0) {
            context.logWarning("The hard time limit of " + hardLimit.getSeconds()
                    + " seconds is less than or equal to the soft time limit of " + softLimit.getSeconds()
                    + " seconds. This job will fail silently after " + hardLimit.getSeconds() + " seconds.");
        }

        context.logInfo("Running job");

        try {
            return deserializeData(definition, task.getKwargs());
        } catch (Exception e) {
            context.logFailure("Error initializing job:\n" + ExecutionOutcome.stackTraceOf(e));
            return null;
        }
    }

    private ExecutionOutcome run(JobContext context, JobDefinition definition, QueuedTask task,
                                 Map<String, Object> data) {
        String taskId = task.getTaskId();
        try {
            resultRepository.markRunning(taskId, clock.instant());
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to mark result " + taskId + " running", e);
            return ExecutionOutcome.error(e);
        }
        context.setGrouping(JobContext.GROUPING_RUN);

        ChangeContext changeContext = definition.getKind() == JobKind.HOOK_RECEIVER
                ? ChangeContext.jobHook(task.getUser(), task.getClassPath(), taskId)
                : ChangeContext.job(task.getUser(), task.getClassPath(), taskId);

        try (ChangeLogging.Scope scope = ChangeLogging.open(changeContext)) {
            Job job = definition.newInstance();
            ExecutionOutcome outcome = job.run(context, data);
            return outcome != null ? outcome : ExecutionOutcome.success();
        } catch (JobFailedException e) {
            logger.info("Job " + task.getClassPath() + " (" + taskId + ") failed: " + e.getMessage());
            return ExecutionOutcome.failure(e.getMessage());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // Linkage and assertion errors from job code end the run like any exception
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.log(Level.SEVERE, "Job " + task.getClassPath() + " (" + taskId + ") raised an exception", e);
            return ExecutionOutcome.error(e);
        }
    }

    /**
     * Rebuild typed input from the stored kwargs.
     *
     * <p>Keys that are not declared as variables are ignored. Every declared variable gets an
     * entry; a missing or null value for a required variable is an error.</p>
     *
     * @throws ValidationException if values cannot be converted or required values are missing
     * @throws ObjectNotFoundException if a referenced object or file no longer exists
     */
    Map<String, Object> deserializeData(JobDefinition definition, Map<String, Object> kwargs)
            throws ValidationException, ObjectNotFoundException {
        Map<String, JobVariable<?, ?>> variables = definition.getVariables();
        for (String key : kwargs.keySet()) {
            if (!variables.containsKey(key)) {
                logger.fine("Ignoring undeclared input " + key + " for " + definition.getClassPath());
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        ValidationException.Collector errors = new ValidationException.Collector();
        for (Map.Entry<String, JobVariable<?, ?>> entry : variables.entrySet()) {
            String name = entry.getKey();
            JobVariable<?, ?> variable = entry.getValue();
            Object stored = kwargs.get(name);
            if (stored == null && variable.isRequired()) {
                errors.add(name, name + " is a required field");
                continue;
            }
            try {
                data.put(name, variable.deserialize(stored, services));
            } catch (ValidationException e) {
                errors.addAllAs(name, e);
            }
        }
        errors.throwIfNotEmpty();
        return data;
    }

    private void cleanup(JobContext context, Collection<String> fileVariables, QueuedTask task) {
        context.setGrouping(JobContext.GROUPING_CLEANUP);
        Set<String> deleted = new HashSet<>();
        for (String name : fileVariables) {
            Object handle = task.getKwargs().get(name);
            if (handle == null || !deleted.add(handle.toString())) {
                continue;
            }
            try {
                if (!services.getFileStorage().delete(handle.toString())) {
                    context.logWarning("Uploaded file for " + name + " was already gone");
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to delete uploaded file " + handle, e);
                context.logWarning("Failed to delete uploaded file for " + name + ": " + e.getMessage());
            }
        }
    }

    private JobResult complete(String taskId, ExecutionState state, Object returnValue) throws SQLException {
        JobStatus status = state.toJobStatus();
        String resultJson = returnValue == null ? null : gson.toJson(returnValue);
        if (!resultRepository.completeResult(taskId, status, resultJson, clock.instant())) {
            logger.warning("Result " + taskId + " was already terminal, keeping the stored status");
        } else {
            logger.info("Job result " + taskId + " finished with status " + status.getDisplayName());
        }
        return resultRepository.getResult(taskId);
    }

    private void createResult(QueuedTask task, JobDefinition definition) throws SQLException {
        JobResult result = new JobResult();
        result.setId(task.getTaskId());
        result.setClassPath(task.getClassPath());
        result.setJobName(definition != null ? definition.getName() : task.getClassPath());
        result.setStatus(JobStatus.PENDING);
        result.setCreatedAt(clock.instant());
        result.setUserName(task.getUser());
        result.setScheduledJobId(task.getScheduledJobId());
        if (definition == null || !definition.hasSensitiveVariables()) {
            result.setTaskKwargs(JobKwargs.toJson(task.getKwargs()));
        }
        resultRepository.createResult(result);
    }

    /**
     * Record that the worker was killed at the hard time limit.
     *
     * @return true if this call made the result ERRORED
     * @throws SQLException if database operation fails
     */
    public boolean markTimedOut(String taskId) throws SQLException {
        JobResult result = resultRepository.getResult(taskId);
        if (result == null || result.getStatus().isTerminal()) {
            return false;
        }
        JobContext context = activeContexts.get(taskId);
        String grouping = context != null ? context.getGrouping() : JobContext.GROUPING_RUN;
        resultRepository.appendLogEntry(new JobLogEntry(taskId, LogLevel.FAILURE, grouping,
                "Job exceeded its hard time limit and was terminated", null));
        boolean updated = resultRepository.completeResult(taskId, JobStatus.ERRORED, null, clock.instant());
        if (updated) {
            logger.warning("Job result " + taskId + " timed out");
        }
        return updated;
    }

    /**
     * Raise the soft time limit flag of a running execution.
     *
     * @return true if the task is currently executing
     */
    public boolean signalSoftTimeLimit(String taskId) {
        JobContext context = activeContexts.get(taskId);
        if (context == null) {
            return false;
        }
        context.signalSoftTimeLimit();
        context.logWarning("Soft time limit exceeded");
        return true;
    }

    /**
     * Soft limit the queue enforces for a task: the task's own, else the configured default.
     */
    Duration effectiveSoftTimeLimit(QueuedTask task) {
        return orDefault(task.getSoftTimeLimit(), defaultSoftTimeLimit);
    }

    Duration effectiveTimeLimit(QueuedTask task) {
        return orDefault(task.getTimeLimit(), defaultTimeLimit);
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
