package com.jobrunner.engine;

import java.time.Instant;
import java.util.Map;

/**
 * Hands tasks to workers that run them through {@link JobExecutor}.
 *
 * <p>Enqueueing never runs the job on the calling thread; the outcome is observed later by
 * polling the {@link com.jobrunner.core.JobResult} stored under the returned task id.</p>
 */
public interface TaskQueue {

    /**
     * Queue a task.
     *
     * @return the task id
     * @throws java.util.concurrent.RejectedExecutionException if the queue no longer accepts work
     */
    String enqueue(QueuedTask task);

    default String enqueue(String classPath, Map<String, Object> kwargs, String queueName, Instant eta, String user) {
        return enqueue(QueuedTask.builder(classPath)
                .kwargs(kwargs)
                .queueName(queueName)
                .eta(eta)
                .user(user)
                .build());
    }
}
