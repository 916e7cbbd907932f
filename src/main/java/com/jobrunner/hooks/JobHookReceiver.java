package com.jobrunner.hooks;

import com.jobrunner.changes.ObjectChange;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.Job;
import com.jobrunner.core.JobContext;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobKind;
import com.jobrunner.vars.ObjectVar;

import java.util.Map;

/**
 * Base for jobs run by {@link JobHook}s.
 *
 * <p>Definitions of hook receivers use {@link #BASE_DEFINITION} as their parent, which
 * declares the single {@code object_change} input and marks the job as a hook receiver:</p>
 * <pre>{@code
 * JobDefinition.builder("AuditDevices")
 *         .parent(JobHookReceiver.BASE_DEFINITION)
 *         .factory(AuditDevices::new)
 *         .build();
 * }</pre>
 *
 * <p>Changes made while a hook receiver runs are recorded in a job hook context and never
 * trigger hooks themselves.</p>
 */
public abstract class JobHookReceiver implements Job {

    public static final String OBJECT_CHANGE = "object_change";

    public static final JobDefinition BASE_DEFINITION = JobDefinition.builder("JobHookReceiver")
            .kind(JobKind.HOOK_RECEIVER)
            .hasSensitiveVariables(false)
            .variable(OBJECT_CHANGE, new ObjectVar(ObjectChange.OBJECT_TYPE).required(true))
            .build();

    @Override
    public final ExecutionOutcome run(JobContext context, Map<String, Object> data) throws Exception {
        Object change = data.get(OBJECT_CHANGE);
        if (!(change instanceof ObjectChange)) {
            return context.logFailure("Expected an object change, got " + change);
        }
        return receiveJobHook(context, (ObjectChange) change);
    }

    /**
     * Handle one recorded change.
     *
     * @param context logging for this execution
     * @param change the change that triggered the hook
     * @return the outcome of the run
     * @throws Exception any unexpected problem; recorded as an errored run
     */
    protected abstract ExecutionOutcome receiveJobHook(JobContext context, ObjectChange change) throws Exception;
}
