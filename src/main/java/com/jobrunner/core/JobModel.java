package com.jobrunner.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted mirror of a {@link JobDefinition}, stored in {@code job_models}.
 *
 * <p>The model is the durable source of truth for execution policy. Discovery copies the
 * definition's values into it on every synchronization, except for fields whose
 * {@code *Override} flag is set: those keep the value an administrator chose.</p>
 *
 * <p>Newly discovered jobs start disabled. Jobs whose source disappears are kept, marked
 * not installed and disabled, so their results stay attached to something.</p>
 */
public class JobModel {
    private String id;
    private String sourceGrouping;
    private String moduleName;
    private String jobClassName;
    private JobKind kind = JobKind.STANDARD;
    private boolean installed = true;
    private boolean enabled;
    private boolean readOnly;

    private String name;
    private boolean nameOverride;
    private String grouping;
    private boolean groupingOverride;
    private String description = "";
    private boolean descriptionOverride;
    private boolean hidden;
    private boolean hiddenOverride;
    private boolean approvalRequired;
    private boolean approvalRequiredOverride;
    private boolean hasSensitiveVariables = true;
    private boolean hasSensitiveVariablesOverride;
    private Duration softTimeLimit = Duration.ZERO;
    private boolean softTimeLimitOverride;
    private Duration timeLimit = Duration.ZERO;
    private boolean timeLimitOverride;
    private List<String> taskQueues = new ArrayList<>();
    private boolean taskQueuesOverride;

    /**
     * Copy definition values into every field that is not overridden.
     *
     * @param definition the discovered definition; must be bound to a class path
     * @param moduleDisplayName grouping used when the definition declares none
     */
    public void syncFrom(JobDefinition definition, String moduleDisplayName) {
        ClassPath classPath = definition.getClassPath();
        this.sourceGrouping = classPath.getSourceGrouping();
        this.moduleName = classPath.getModuleName();
        this.jobClassName = classPath.getClassName();
        this.kind = definition.getKind();
        this.readOnly = definition.isReadOnly();
        this.installed = true;
        if (!nameOverride) {
            this.name = definition.getName();
        }
        if (!groupingOverride) {
            this.grouping = definition.getGrouping() != null ? definition.getGrouping() : moduleDisplayName;
        }
        if (!descriptionOverride) {
            this.description = definition.getDescription();
        }
        if (!hiddenOverride) {
            this.hidden = definition.isHidden();
        }
        if (!approvalRequiredOverride) {
            this.approvalRequired = definition.isApprovalRequired();
        }
        if (!hasSensitiveVariablesOverride) {
            this.hasSensitiveVariables = definition.hasSensitiveVariables();
        }
        if (!softTimeLimitOverride) {
            this.softTimeLimit = definition.getSoftTimeLimit();
        }
        if (!timeLimitOverride) {
            this.timeLimit = definition.getTimeLimit();
        }
        if (!taskQueuesOverride) {
            this.taskQueues = new ArrayList<>(definition.getTaskQueues());
        }
    }

    /**
     * Check the model's policy before it is saved or a run is submitted.
     *
     * <p>A job that requires approval stores its input until someone approves it, so it must
     * not declare sensitive variables. Both fields are flagged, whichever changed last.</p>
     *
     * @throws ValidationException if the policy is inconsistent
     */
    public void validate() throws ValidationException {
        ValidationException.Collector errors = new ValidationException.Collector();
        if (approvalRequired && hasSensitiveVariables) {
            String message = "A job that may have sensitive variables cannot be marked as requiring approval";
            errors.add("approval_required", message);
            errors.add("has_sensitive_variables", message);
        }
        if (softTimeLimit.isNegative()) {
            errors.add("soft_time_limit", "Ensure this value is greater than or equal to 0.");
        }
        if (timeLimit.isNegative()) {
            errors.add("time_limit", "Ensure this value is greater than or equal to 0.");
        }
        errors.throwIfNotEmpty();
    }

    public ClassPath getClassPath() {
        return new ClassPath(sourceGrouping, moduleName, jobClassName);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getSourceGrouping() { return sourceGrouping; }
    public void setSourceGrouping(String sourceGrouping) { this.sourceGrouping = sourceGrouping; }

    public String getModuleName() { return moduleName; }
    public void setModuleName(String moduleName) { this.moduleName = moduleName; }

    public String getJobClassName() { return jobClassName; }
    public void setJobClassName(String jobClassName) { this.jobClassName = jobClassName; }

    public JobKind getKind() { return kind; }
    public void setKind(JobKind kind) { this.kind = kind; }

    public boolean isInstalled() { return installed; }
    public void setInstalled(boolean installed) { this.installed = installed; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isReadOnly() { return readOnly; }
    public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isNameOverride() { return nameOverride; }
    public void setNameOverride(boolean nameOverride) { this.nameOverride = nameOverride; }

    public String getGrouping() { return grouping; }
    public void setGrouping(String grouping) { this.grouping = grouping; }

    public boolean isGroupingOverride() { return groupingOverride; }
    public void setGroupingOverride(boolean groupingOverride) { this.groupingOverride = groupingOverride; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isDescriptionOverride() { return descriptionOverride; }
    public void setDescriptionOverride(boolean descriptionOverride) { this.descriptionOverride = descriptionOverride; }

    public boolean isHidden() { return hidden; }
    public void setHidden(boolean hidden) { this.hidden = hidden; }

    public boolean isHiddenOverride() { return hiddenOverride; }
    public void setHiddenOverride(boolean hiddenOverride) { this.hiddenOverride = hiddenOverride; }

    public boolean isApprovalRequired() { return approvalRequired; }
    public void setApprovalRequired(boolean approvalRequired) { this.approvalRequired = approvalRequired; }

    public boolean isApprovalRequiredOverride() { return approvalRequiredOverride; }
    public void setApprovalRequiredOverride(boolean approvalRequiredOverride) { this.approvalRequiredOverride = approvalRequiredOverride; }

    public boolean hasSensitiveVariables() { return hasSensitiveVariables; }
    public void setHasSensitiveVariables(boolean hasSensitiveVariables) { this.hasSensitiveVariables = hasSensitiveVariables; }

    public boolean isHasSensitiveVariablesOverride() { return hasSensitiveVariablesOverride; }
    public void setHasSensitiveVariablesOverride(boolean hasSensitiveVariablesOverride) { this.hasSensitiveVariablesOverride = hasSensitiveVariablesOverride; }

    public Duration getSoftTimeLimit() { return softTimeLimit; }
    public void setSoftTimeLimit(Duration softTimeLimit) { this.softTimeLimit = softTimeLimit; }

    public boolean isSoftTimeLimitOverride() { return softTimeLimitOverride; }
    public void setSoftTimeLimitOverride(boolean softTimeLimitOverride) { this.softTimeLimitOverride = softTimeLimitOverride; }

    public Duration getTimeLimit() { return timeLimit; }
    public void setTimeLimit(Duration timeLimit) { this.timeLimit = timeLimit; }

    public boolean isTimeLimitOverride() { return timeLimitOverride; }
    public void setTimeLimitOverride(boolean timeLimitOverride) { this.timeLimitOverride = timeLimitOverride; }

    public List<String> getTaskQueues() { return taskQueues; }
    public void setTaskQueues(List<String> taskQueues) { this.taskQueues = new ArrayList<>(taskQueues); }

    public boolean isTaskQueuesOverride() { return taskQueuesOverride; }
    public void setTaskQueuesOverride(boolean taskQueuesOverride) { this.taskQueuesOverride = taskQueuesOverride; }

    @Override
    public String toString() {
        return "JobModel{" + sourceGrouping + "/" + moduleName + "/" + jobClassName + ", enabled=" + enabled + "}";
    }
}
