package com.jobrunner.engine;

import java.io.Closeable;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link TaskQueue} backed by thread pools.
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>One fixed pool per queue name, created on first use</li>
 *   <li>Delaying tasks with an ETA until it has passed</li>
 *   <li>Signalling the soft time limit to the running job</li>
 *   <li>Interrupting the worker at the hard time limit and recording the timeout</li>
 *   <li>Graceful shutdown that lets in-flight tasks finish</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> pools are created under the instance lock. ETAs and time limits
 * share a single scheduler thread; its tasks only flip flags or cancel futures.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ExecutorTaskQueue queue = new ExecutorTaskQueue(executor, "default", 4, Clock.systemUTC());
 * String taskId = queue.enqueue("local/backup/BackupConfigs", kwargs, "default", null, "admin");
 * ...
 * queue.close(); // Waits up to 60 seconds
 * }</pre>
 *
 * @see Worker
 * @see JobExecutor
 * @author Job Queue Team
 */
public class ExecutorTaskQueue implements TaskQueue, Closeable {
    private static final Logger logger = Logger.getLogger(ExecutorTaskQueue.class.getName());

    private final JobExecutor executor;
    private final String defaultQueue;
    private final int concurrency;
    private final Clock clock;
    private final Map<String, ExecutorService> pools = new LinkedHashMap<>();
    private final ScheduledExecutorService timer;
    private final AtomicBoolean running;

    /**
     * @param executor executor that runs picked-up tasks
     * @param defaultQueue queue used for tasks that name none
     * @param concurrency worker threads per queue
     * @param clock clock ETAs are measured against
     */
    public ExecutorTaskQueue(JobExecutor executor, String defaultQueue, int concurrency, Clock clock) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.executor = executor;
        this.defaultQueue = defaultQueue;
        this.concurrency = concurrency;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor();
        this.running = new AtomicBoolean(true);

        logger.info("Task queue initialized with " + concurrency + " workers per queue");
    }

    @Override
    public String enqueue(QueuedTask task) {
        if (!running.get()) {
            throw new RejectedExecutionException("Task queue is shut down, rejecting " + task);
        }
        Instant eta = task.getEta();
        Duration delay = eta == null ? Duration.ZERO : Duration.between(clock.instant(), eta);
        if (delay.isNegative() || delay.isZero()) {
            dispatch(task);
        } else {
            timer.schedule(() -> dispatch(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("Task " + task.getTaskId() + " scheduled to start at " + eta);
        }
        return task.getTaskId();
    }

    private void dispatch(QueuedTask task) {
        if (!running.get()) {
            logger.warning("Dropping task " + task.getTaskId() + ": task queue is shut down");
            return;
        }
        String queueName = task.getQueueName() != null ? task.getQueueName() : defaultQueue;
        List<ScheduledFuture<?>> timers = new ArrayList<>();
        Worker worker = new Worker(task, executor, () -> {
            synchronized (timers) {
                timers.forEach(t -> t.cancel(false));
            }
        });

        Future<?> future;
        try {
            future = poolFor(queueName).submit(worker);
        } catch (RejectedExecutionException e) {
            logger.log(Level.SEVERE, "Queue " + queueName + " rejected task " + task.getTaskId(), e);
            return;
        }
        logger.info("Task " + task.getTaskId() + " submitted to queue " + queueName);

        Duration softLimit = executor.effectiveSoftTimeLimit(task);
        Duration hardLimit = executor.effectiveTimeLimit(task);
        synchronized (timers) {
            if (future.isDone()) {
                return;
            }
            timers.add(timer.schedule(() -> {
                if (!future.isDone()) {
                    executor.signalSoftTimeLimit(task.getTaskId());
                }
            }, softLimit.toMillis(), TimeUnit.MILLISECONDS));
            timers.add(timer.schedule(() -> killAtHardLimit(task, future), hardLimit.toMillis(), TimeUnit.MILLISECONDS));
        }
    }

    private void killAtHardLimit(QueuedTask task, Future<?> future) {
        if (future.isDone()) {
            return;
        }
        logger.warning("Task " + task.getTaskId() + " reached its hard time limit, terminating it");
        // Record the timeout before interrupting the worker
        try {
            executor.markTimedOut(task.getTaskId());
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to record timeout of task " + task.getTaskId(), e);
        }
        future.cancel(true);
    }

    private synchronized ExecutorService poolFor(String queueName) {
        return pools.computeIfAbsent(queueName, name -> {
            logger.info("Starting " + concurrency + " workers for queue " + name);
            return Executors.newFixedThreadPool(concurrency);
        });
    }

    public synchronized List<String> getQueueNames() {
        return new ArrayList<>(pools.keySet());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stop accepting tasks and wait for in-flight ones.
     *
     * <p>Pending ETAs are dropped. Workers get 60 seconds to finish before they are interrupted.</p>
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Initiating graceful shutdown...");

        List<ExecutorService> toStop;
        synchronized (this) {
            toStop = new ArrayList<>(pools.values());
        }
        toStop.forEach(ExecutorService::shutdown);

        try {
            for (ExecutorService pool : toStop) {
                if (!pool.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warning("Forcing shutdown of remaining tasks");
                    pool.shutdownNow();
                    if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                        logger.severe("Worker pool did not terminate after forced shutdown");
                    }
                }
            }
        } catch (InterruptedException e) {
            toStop.forEach(ExecutorService::shutdownNow);
            Thread.currentThread().interrupt();
        } finally {
            timer.shutdownNow();
        }

        logger.info("Task queue shutdown complete");
    }
}
