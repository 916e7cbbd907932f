package com.jobrunner.core;

import java.util.Map;

/**
 * The body of a job.
 *
 * <p>Implementations hold the business logic only. Everything else a job is (its name,
 * variables, time limits, approval policy) lives on the {@link JobDefinition} whose factory
 * creates the instance. A fresh instance is created for every execution, so implementations
 * may keep per-run state in fields.</p>
 *
 * <p><b>Outcome contract:</b></p>
 * <ul>
 *   <li>return {@link ExecutionOutcome#success(Object)} when the work is done</li>
 *   <li>return {@code context.logFailure(message)} to stop with a failure</li>
 *   <li>throw anything else to have the run recorded as errored with its stack trace</li>
 * </ul>
 *
 * <pre>{@code
 * public ExecutionOutcome run(JobContext context, Map<String, Object> data) {
 *     DomainObject device = (DomainObject) data.get("device");
 *     if (device == null) {
 *         return context.logFailure("No device given");
 *     }
 *     context.logSuccess(device, "Checked");
 *     return ExecutionOutcome.success(device.getId());
 * }
 * }</pre>
 *
 * @see JobDefinition#newInstance()
 * @author Job Queue Team
 */
public interface Job {

    /**
     * Do the work.
     *
     * @param context logging and limit signalling for this execution
     * @param data deserialized input keyed by variable name; every declared variable has an entry
     * @return the outcome of the run
     * @throws Exception any unexpected problem; recorded as an errored run
     */
    ExecutionOutcome run(JobContext context, Map<String, Object> data) throws Exception;
}
