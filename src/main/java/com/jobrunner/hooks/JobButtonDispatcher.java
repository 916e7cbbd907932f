package com.jobrunner.hooks;

import com.jobrunner.core.DomainObject;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobDisabledException;
import com.jobrunner.core.JobKind;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ObjectRepository;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.JobHookRepository;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.scheduling.ExecutionRequest;
import com.jobrunner.scheduling.JobScheduler;
import com.jobrunner.scheduling.SubmitResult;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs the job behind a button pressed on an object.
 *
 * <p>Unlike hooks, every problem is reported to the caller: an unknown button, an object type
 * the button is not shown on, or an object that does not exist. Nothing is queued then.</p>
 */
public class JobButtonDispatcher {
    private static final Logger logger = Logger.getLogger(JobButtonDispatcher.class.getName());

    private final JobHookRepository repository;
    private final ObjectRepository objectRepository;
    private final JobScheduler scheduler;
    private final JobDiscovery discovery;

    public JobButtonDispatcher(JobHookRepository repository, ObjectRepository objectRepository,
                               JobScheduler scheduler, JobDiscovery discovery) {
        this.repository = repository;
        this.objectRepository = objectRepository;
        this.scheduler = scheduler;
        this.discovery = discovery;
    }

    /**
     * Press a button on an object.
     *
     * @param buttonId the button
     * @param objectPk id of the object it was pressed on
     * @param objectType type of that object
     * @param user the user pressing it
     * @return the submission result
     * @throws ObjectNotFoundException if the button or the object does not exist
     * @throws ValidationException if the button does not apply to the object type, or the input is rejected
     * @throws JobDisabledException if the button's job is disabled
     * @throws SQLException if database operation fails
     */
    public SubmitResult press(String buttonId, String objectPk, String objectType, String user)
            throws ObjectNotFoundException, ValidationException, JobDisabledException, SQLException {
        JobButton button = repository.findButton(buttonId);
        if (button == null) {
            throw new ObjectNotFoundException("Job button " + buttonId + " does not exist");
        }
        if (!button.getContentTypes().contains(objectType)) {
            throw new ValidationException("object_model_name",
                    "Job button " + button.getName() + " is not available for " + objectType);
        }
        DomainObject object = objectRepository.findById(objectType, objectPk)
                .orElseThrow(() -> new ObjectNotFoundException(objectType + " matching query does not exist.",
                        objectType, List.of(objectPk)));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(JobButtonReceiver.OBJECT_PK, object.getId());
        data.put(JobButtonReceiver.OBJECT_MODEL_NAME, object.getObjectType());
        SubmitResult result = scheduler.submit(ExecutionRequest.of(button.getClassPath(), data), user);
        logger.info("Job button " + button.getName() + " pressed on " + objectType + " " + objectPk + " by " + user);
        return result;
    }

    /**
     * Check and store a button.
     *
     * @throws ValidationException if the job is not a button receiver or no type is given
     * @throws SQLException if database operation fails
     */
    public void registerButton(JobButton button) throws ValidationException, SQLException {
        ValidationException.Collector errors = new ValidationException.Collector();
        JobDefinition definition = discovery.getJob(button.getClassPath());
        if (definition == null) {
            errors.add("job", "Job " + button.getClassPath() + " does not exist");
        } else if (definition.getKind() != JobKind.BUTTON_RECEIVER) {
            errors.add("job", "A job button must run a job button receiver");
        }
        if (button.getContentTypes().isEmpty()) {
            errors.add("content_types", "This field is required.");
        }
        errors.throwIfNotEmpty();
        repository.saveButton(button);
        logger.info("Registered " + button);
    }
}
