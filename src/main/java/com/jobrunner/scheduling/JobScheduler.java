package com.jobrunner.scheduling;

import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobDisabledException;
import com.jobrunner.core.JobKwargs;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.JobModelRepository;
import com.jobrunner.db.ScheduledJobRepository;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.engine.QueuedTask;
import com.jobrunner.engine.TaskQueue;
import com.jobrunner.vars.JobVariable;
import com.jobrunner.vars.VariableServices;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns run requests into enqueued tasks or persisted schedules.
 *
 * <p><b>Submission steps:</b></p>
 * <ol>
 *   <li>Resolve the job and its model; unknown jobs fail on {@code class_path}, disabled
 *       ones with {@link JobDisabledException}</li>
 *   <li>Check the model policy (approval and sensitive variables are exclusive)</li>
 *   <li>Validate the input, rejecting undeclared keys, and serialize it</li>
 *   <li>Pick the task queue</li>
 *   <li>Enqueue, or persist a {@link ScheduledJob} for deferred, recurring or
 *       approval-pending runs</li>
 * </ol>
 *
 * <p>Nothing is enqueued or stored unless every check passed.</p>
 *
 * @see ScheduleTicker
 */
public class JobScheduler {
    private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

    static final String UNKNOWN_PROPERTY_MESSAGE = "Job data contained an unknown property";

    private final JobDiscovery discovery;
    private final JobModelRepository modelRepository;
    private final ScheduledJobRepository scheduleRepository;
    private final TaskQueue taskQueue;
    private final VariableServices services;
    private final String defaultQueue;
    private final Clock clock;

    public JobScheduler(JobDiscovery discovery, JobModelRepository modelRepository,
                        ScheduledJobRepository scheduleRepository, TaskQueue taskQueue,
                        VariableServices services, String defaultQueue, Clock clock) {
        this.discovery = discovery;
        this.modelRepository = modelRepository;
        this.scheduleRepository = scheduleRepository;
        this.taskQueue = taskQueue;
        this.services = services;
        this.defaultQueue = defaultQueue;
        this.clock = clock;
    }

    /**
     * Submit a run request on behalf of a user.
     *
     * @param request what to run, with which input and when
     * @param user the requesting user
     * @return the task id, or the persisted schedule
     * @throws ValidationException if the job, its policy, the input or the schedule is invalid
     * @throws JobDisabledException if the job is not enabled
     * @throws SQLException if database operation fails
     */
    public SubmitResult submit(ExecutionRequest request, String user)
            throws ValidationException, JobDisabledException, SQLException {
        JobDefinition definition = discovery.getJob(request.getClassPath());
        if (definition == null) {
            throw new ValidationException("class_path", "Job " + request.getClassPath() + " does not exist");
        }
        JobModel model = modelRepository.findByClassPath(definition.getClassPath());
        if (model == null || !model.isInstalled()) {
            throw new ValidationException("class_path", "Job " + request.getClassPath() + " is not installed");
        }
        if (!model.isEnabled()) {
            throw new JobDisabledException(request.getClassPath());
        }
        model.validate();

        Map<String, Object> kwargs = validateData(definition, request.getData());
        String queue = resolveTaskQueue(model, request.getTaskQueue());

        ScheduleSpec schedule = request.getSchedule();
        Instant now = clock.instant();
        if (schedule == null || schedule.getInterval() == JobExecutionType.IMMEDIATELY) {
            if (model.isApprovalRequired()) {
                ScheduledJob pending = newScheduledJob(model, user, queue, kwargs);
                pending.setName(schedule != null && schedule.getName() != null
                        ? schedule.getName()
                        : model.getName() + " - " + user + " - " + now);
                pending.setInterval(JobExecutionType.IMMEDIATELY);
                pending.setStartTime(now);
                pending.setNextRun(now);
                scheduleRepository.save(pending);
                logger.info("Job " + model.getClassPath() + " requires approval, created pending run " + pending.getId());
                return SubmitResult.scheduled(pending);
            }
            String taskId = taskQueue.enqueue(QueuedTask.builder(model.getClassPath().toString())
                    .kwargs(kwargs)
                    .queueName(queue)
                    .user(user)
                    .softTimeLimit(model.getSoftTimeLimit())
                    .timeLimit(model.getTimeLimit())
                    .fileVariables(Set.copyOf(definition.getFileVariableNames()))
                    .build());
            logger.info("Enqueued " + model.getClassPath() + " as task " + taskId + " on " + queue);
            return SubmitResult.enqueued(taskId);
        }

        if (model.hasSensitiveVariables()) {
            throw new ValidationException("schedule",
                    "Unable to schedule job: Job may have sensitive input variables");
        }
        validateSchedule(schedule, now);

        ScheduledJob scheduled = newScheduledJob(model, user, queue, kwargs);
        scheduled.setName(schedule.getName());
        scheduled.setInterval(schedule.getInterval());
        scheduled.setCrontab(schedule.getInterval() == JobExecutionType.CUSTOM ? schedule.getCrontab() : null);
        scheduled.setStartTime(schedule.getStartTime() != null ? schedule.getStartTime() : now);
        scheduled.setNextRun(firstRun(schedule, now));
        scheduleRepository.save(scheduled);
        logger.info("Scheduled " + model.getClassPath() + " as " + scheduled);
        return SubmitResult.scheduled(scheduled);
    }

    /**
     * Validate raw input and convert it to its stored form.
     *
     * @return serialized values keyed by variable name, in declaration order
     * @throws ValidationException naming every undeclared key, or every invalid variable
     */
    public Map<String, Object> validateData(JobDefinition definition, Map<String, Object> data)
            throws ValidationException {
        Map<String, JobVariable<?, ?>> variables = definition.getVariables();

        ValidationException.Collector unknown = new ValidationException.Collector();
        for (String key : data.keySet()) {
            if (!variables.containsKey(key)) {
                unknown.add(key, UNKNOWN_PROPERTY_MESSAGE);
            }
        }
        unknown.throwIfNotEmpty();

        ValidationException.Collector errors = new ValidationException.Collector();
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, JobVariable<?, ?>> entry : variables.entrySet()) {
            try {
                values.put(entry.getKey(), entry.getValue().validate(data.get(entry.getKey()), services));
            } catch (ValidationException e) {
                errors.addAllAs(entry.getKey(), e);
            }
        }
        errors.throwIfNotEmpty();

        // Only serialize once everything is valid, so no upload is stored for a rejected request
        Map<String, Object> kwargs = new LinkedHashMap<>();
        values.forEach((name, value) -> kwargs.put(name, variables.get(name).serializeUnchecked(value, services)));
        return kwargs;
    }

    /**
     * The requested queue if the job allows it, else the job's first queue, else the default.
     */
    public String resolveTaskQueue(JobModel model, String requested) {
        List<String> allowed = model.getTaskQueues();
        if (allowed == null || allowed.isEmpty()) {
            return defaultQueue;
        }
        if (requested != null && allowed.contains(requested)) {
            return requested;
        }
        return allowed.get(0);
    }

    private void validateSchedule(ScheduleSpec schedule, Instant now) throws ValidationException {
        if (schedule.getName() == null || schedule.getName().isBlank()) {
            throw new ValidationException("name", "Please provide a name for the job schedule.");
        }
        boolean custom = schedule.getInterval() == JobExecutionType.CUSTOM;
        Instant start = schedule.getStartTime();
        if ((start == null && !custom) || (start != null && start.isBefore(now))) {
            throw new ValidationException("start_time",
                    "Please enter a valid date and time greater than or equal to the current date and time.");
        }
        if (custom) {
            CronSchedules.parse(schedule.getCrontab());
        }
    }

    private static Instant firstRun(ScheduleSpec schedule, Instant now) throws ValidationException {
        if (schedule.getInterval() == JobExecutionType.CUSTOM) {
            // A cron schedule fires at its first match after the start time
            Instant from = schedule.getStartTime() != null ? schedule.getStartTime() : now;
            return CronSchedules.nextFire(schedule.getCrontab(), from);
        }
        return schedule.getStartTime();
    }

    private static ScheduledJob newScheduledJob(JobModel model, String user, String queue, Map<String, Object> kwargs) {
        ScheduledJob job = new ScheduledJob();
        job.setClassPath(model.getClassPath().toString());
        job.setUserName(user);
        job.setTaskQueue(queue);
        job.setTaskKwargs(JobKwargs.toJson(kwargs));
        job.setApprovalRequired(model.isApprovalRequired());
        return job;
    }

    /**
     * Approve a pending schedule so the ticker may fire it.
     *
     * @throws ObjectNotFoundException if there is no such schedule
     * @throws SQLException if database operation fails
     */
    public ScheduledJob approve(String scheduledJobId, String approver) throws ObjectNotFoundException, SQLException {
        ScheduledJob job = scheduleRepository.findById(scheduledJobId);
        if (job == null) {
            throw new ObjectNotFoundException("Scheduled job " + scheduledJobId + " does not exist");
        }
        if (job.getApprovedAt() != null) {
            logger.info("Scheduled job " + scheduledJobId + " already approved by " + job.getApprovedBy());
            return job;
        }
        Instant now = clock.instant();
        job.setApprovedBy(approver);
        job.setApprovedAt(now);
        if (job.getInterval() == JobExecutionType.IMMEDIATELY && job.getNextRun().isBefore(now)) {
            job.setNextRun(now);
        }
        scheduleRepository.save(job);
        logger.info("Scheduled job " + scheduledJobId + " approved by " + approver);
        return job;
    }

    /**
     * Delete a schedule.
     *
     * @return true if it existed
     * @throws SQLException if database operation fails
     */
    public boolean cancel(String scheduledJobId) throws SQLException {
        boolean deleted = scheduleRepository.delete(scheduledJobId);
        if (deleted) {
            logger.info("Scheduled job " + scheduledJobId + " cancelled");
        }
        return deleted;
    }
}
