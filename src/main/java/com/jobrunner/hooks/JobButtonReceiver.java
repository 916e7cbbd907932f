package com.jobrunner.hooks;

import com.jobrunner.core.DomainObject;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.Job;
import com.jobrunner.core.JobContext;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobKind;
import com.jobrunner.vars.StringVar;

import java.util.Map;
import java.util.Optional;

/**
 * Base for jobs run by {@link JobButton}s. The object the button was pressed on is looked
 * up again when the job runs.
 */
public abstract class JobButtonReceiver implements Job {

    public static final String OBJECT_PK = "object_pk";
    public static final String OBJECT_MODEL_NAME = "object_model_name";

    public static final JobDefinition BASE_DEFINITION = JobDefinition.builder("JobButtonReceiver")
            .kind(JobKind.BUTTON_RECEIVER)
            .hasSensitiveVariables(false)
            .variable(OBJECT_PK, new StringVar().required(true))
            .variable(OBJECT_MODEL_NAME, new StringVar().required(true))
            .build();

    @Override
    public final ExecutionOutcome run(JobContext context, Map<String, Object> data) throws Exception {
        String objectType = (String) data.get(OBJECT_MODEL_NAME);
        String objectPk = (String) data.get(OBJECT_PK);
        Optional<DomainObject> object = context.getObjectRepository().findById(objectType, objectPk);
        if (object.isEmpty()) {
            return context.logFailure(objectType + " " + objectPk + " no longer exists");
        }
        return receiveJobButton(context, object.get());
    }

    protected abstract ExecutionOutcome receiveJobButton(JobContext context, DomainObject object) throws Exception;
}
