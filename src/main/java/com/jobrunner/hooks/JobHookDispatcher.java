package com.jobrunner.hooks;

import com.jobrunner.changes.ChangeContextType;
import com.jobrunner.changes.ObjectChange;
import com.jobrunner.changes.ObjectChangeListener;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobDisabledException;
import com.jobrunner.core.JobKind;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.JobHookRepository;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.scheduling.ExecutionRequest;
import com.jobrunner.scheduling.JobScheduler;
import com.jobrunner.scheduling.SubmitResult;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the matching job hooks for every recorded change.
 *
 * <p>Registered as a {@link com.jobrunner.changes.ChangeLogger} listener, so it runs on the
 * thread that recorded the change, before the recording call returns.</p>
 *
 * <p><b>Skipped changes:</b></p>
 * <ul>
 *   <li>changes made by a hook receiver, which would otherwise chain hooks forever</li>
 *   <li>changes to object types that are not change-logged</li>
 * </ul>
 *
 * <p>Each matching hook is submitted on behalf of the user who made the change, with the
 * change id as the only input. A hook that fails to submit is logged; the others still run.</p>
 */
public class JobHookDispatcher implements ObjectChangeListener {
    private static final Logger logger = Logger.getLogger(JobHookDispatcher.class.getName());

    private final JobHookRepository repository;
    private final ChangeLoggedTypes changeLoggedTypes;
    private final JobScheduler scheduler;
    private final JobDiscovery discovery;

    public JobHookDispatcher(JobHookRepository repository, ChangeLoggedTypes changeLoggedTypes,
                             JobScheduler scheduler, JobDiscovery discovery) {
        this.repository = repository;
        this.changeLoggedTypes = changeLoggedTypes;
        this.scheduler = scheduler;
        this.discovery = discovery;
    }

    @Override
    public void onObjectChange(ObjectChange change) {
        if (change.getContextType() == ChangeContextType.JOB_HOOK) {
            logger.fine("Skipping job hooks for " + change + ": made by a job hook");
            return;
        }
        if (!changeLoggedTypes.contains(change.getChangedObjectType())) {
            return;
        }

        List<JobHook> hooks;
        try {
            hooks = repository.findMatchingHooks(change.getChangedObjectType(), change.getAction());
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to look up job hooks for " + change, e);
            return;
        }

        for (JobHook hook : hooks) {
            try {
                SubmitResult result = scheduler.submit(
                        ExecutionRequest.of(hook.getClassPath(), Map.of(JobHookReceiver.OBJECT_CHANGE, change.getId())),
                        change.getUser());
                logger.info("Job hook " + hook.getName() + " submitted for " + change + ": " + result);
            } catch (ValidationException | JobDisabledException | SQLException | RuntimeException e) {
                logger.log(Level.SEVERE, "Job hook " + hook.getName() + " failed to submit for " + change, e);
            }
        }
    }

    /**
     * Check and store a hook.
     *
     * @throws ValidationException if the job is not a hook receiver, or nothing would trigger it
     * @throws SQLException if database operation fails
     */
    public void registerHook(JobHook hook) throws ValidationException, SQLException {
        ValidationException.Collector errors = new ValidationException.Collector();
        JobDefinition definition = discovery.getJob(hook.getClassPath());
        if (definition == null) {
            errors.add("job", "Job " + hook.getClassPath() + " does not exist");
        } else if (definition.getKind() != JobKind.HOOK_RECEIVER) {
            errors.add("job", "A job hook must run a job hook receiver");
        }
        if (hook.getContentTypes().isEmpty()) {
            errors.add("content_types", "This field is required.");
        }
        for (String type : hook.getContentTypes()) {
            if (!changeLoggedTypes.contains(type)) {
                errors.add("content_types", type + " is not a change-logged object type");
            }
        }
        if (!hook.isTypeCreate() && !hook.isTypeUpdate() && !hook.isTypeDelete()) {
            errors.add("type_create", "You must select at least one of create, update, or delete.");
        }
        errors.throwIfNotEmpty();
        repository.saveHook(hook);
        logger.info("Registered " + hook);
    }
}
