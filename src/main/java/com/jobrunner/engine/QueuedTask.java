package com.jobrunner.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One unit of work handed to a {@link TaskQueue}: a job class path and its serialized input.
 *
 * <p>The task id doubles as the id of the {@link com.jobrunner.core.JobResult} the worker
 * creates at pickup. A zero time limit means the queue's configured default applies.</p>
 */
public final class QueuedTask {
    private final String taskId;
    private final String classPath;
    private final Map<String, Object> kwargs;
    private final String queueName;
    private final Instant eta;
    private final String user;
    private final Duration softTimeLimit;
    private final Duration timeLimit;
    private final String scheduledJobId;
    private final Set<String> fileVariables;

    private QueuedTask(Builder builder) {
        this.taskId = builder.taskId;
        this.classPath = builder.classPath;
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.queueName = builder.queueName;
        this.eta = builder.eta;
        this.user = builder.user;
        this.softTimeLimit = builder.softTimeLimit;
        this.timeLimit = builder.timeLimit;
        this.scheduledJobId = builder.scheduledJobId;
        this.fileVariables = Set.copyOf(builder.fileVariables);
    }

    public static Builder builder(String classPath) {
        return new Builder(classPath);
    }

    public String getTaskId() {
        return taskId;
    }

    public String getClassPath() {
        return classPath;
    }

    /**
     * Serialized input keyed by variable name, as produced at submission.
     */
    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * Earliest time the task may start, or null to start as soon as a worker is free.
     */
    public Instant getEta() {
        return eta;
    }

    public String getUser() {
        return user;
    }

    public Duration getSoftTimeLimit() {
        return softTimeLimit;
    }

    public Duration getTimeLimit() {
        return timeLimit;
    }

    public String getScheduledJobId() {
        return scheduledJobId;
    }

    /**
     * Names of the file variables in {@link #getKwargs()}, captured at submission so uploads
     * can be cleaned up even if the job is gone by the time a worker picks the task up.
     */
    public Set<String> getFileVariables() {
        return fileVariables;
    }

    @Override
    public String toString() {
        return "QueuedTask{" + taskId + " " + classPath + " on " + queueName + "}";
    }

    public static final class Builder {
        private String taskId = UUID.randomUUID().toString();
        private final String classPath;
        private Map<String, Object> kwargs = Map.of();
        private String queueName;
        private Instant eta;
        private String user;
        private Duration softTimeLimit = Duration.ZERO;
        private Duration timeLimit = Duration.ZERO;
        private String scheduledJobId;
        private Set<String> fileVariables = Set.of();

        private Builder(String classPath) {
            this.classPath = classPath;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder eta(Instant eta) {
            this.eta = eta;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder softTimeLimit(Duration softTimeLimit) {
            this.softTimeLimit = softTimeLimit;
            return this;
        }

        public Builder timeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder scheduledJobId(String scheduledJobId) {
            this.scheduledJobId = scheduledJobId;
            return this;
        }

        public Builder fileVariables(Set<String> fileVariables) {
            this.fileVariables = fileVariables;
            return this;
        }

        public QueuedTask build() {
            return new QueuedTask(this);
        }
    }
}
