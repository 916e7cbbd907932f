package com.jobrunner.engine;

import com.jobrunner.core.JobResult;

import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a single {@link QueuedTask} on a pool thread.
 *
 * <p>Everything about the execution itself (status, log entries, cleanup) is handled by
 * {@link JobExecutor}; the worker only reports problems the executor could not record and
 * tells the queue when the task is done so its time limit timers can be cancelled.</p>
 *
 * <p><b>Thread Safety:</b> each worker runs in its own pool thread and owns its task.</p>
 *
 * @see ExecutorTaskQueue
 * @author Job Queue Team
 */
public class Worker implements Runnable {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final QueuedTask task;
    private final JobExecutor executor;
    private final Runnable onComplete;

    /**
     * @param task the task to run
     * @param executor the executor driving the lifecycle
     * @param onComplete called once the task finished, whatever the outcome
     */
    public Worker(QueuedTask task, JobExecutor executor, Runnable onComplete) {
        this.task = task;
        this.executor = executor;
        this.onComplete = onComplete;
    }

    @Override
    public void run() {
        String taskId = task.getTaskId();
        logger.info("Worker starting task " + taskId + " (" + task.getClassPath() + ")");
        try {
            JobResult result = executor.execute(task);
            if (result != null) {
                logger.info("Worker finished task " + taskId + " with status " + result.getStatus().getDisplayName());
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Database error while executing task " + taskId, e);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error while executing task " + taskId, e);
        } finally {
            onComplete.run();
        }
    }

    public QueuedTask getTask() {
        return task;
    }
}
