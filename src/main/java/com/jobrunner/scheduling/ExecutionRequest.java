package com.jobrunner.scheduling;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request to run a job: class path, raw input, requested queue and optional schedule.
 */
public class ExecutionRequest {
    private final String classPath;
    private final Map<String, Object> data;
    private final String taskQueue;
    private final ScheduleSpec schedule;

    public ExecutionRequest(String classPath, Map<String, Object> data, String taskQueue, ScheduleSpec schedule) {
        this.classPath = classPath;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.taskQueue = taskQueue;
        this.schedule = schedule;
    }

    public static ExecutionRequest of(String classPath, Map<String, Object> data) {
        return new ExecutionRequest(classPath, data, null, null);
    }

    public String getClassPath() {
        return classPath;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * Requested queue, or null for the job's default.
     */
    public String getTaskQueue() {
        return taskQueue;
    }

    /**
     * Schedule, or null to run immediately.
     */
    public ScheduleSpec getSchedule() {
        return schedule;
    }
}
