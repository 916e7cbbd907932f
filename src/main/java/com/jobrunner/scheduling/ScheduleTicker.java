package com.jobrunner.scheduling;

import com.jobrunner.core.ClassPath;
import com.jobrunner.core.JobKwargs;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.JobModelRepository;
import com.jobrunner.db.ScheduledJobRepository;
import com.jobrunner.engine.QueuedTask;
import com.jobrunner.engine.TaskQueue;

import java.io.Closeable;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires persisted schedules whose next run has passed.
 *
 * <p>Each due, enabled and approved {@link ScheduledJob} is enqueued with its stored input.
 * Recurring schedules then move their next run past the current time; one-off schedules
 * ({@code immediately}, {@code future}) are deleted.</p>
 *
 * <p><b>Error Handling:</b> a schedule that cannot be fired is logged and left alone so the
 * others still fire. A database error ends the tick; the next tick tries again.</p>
 *
 * <p><b>Thread Safety:</b> ticks run on one scheduler thread; {@link #fireDueSchedules(Instant)}
 * may also be called directly, which the repositories tolerate.</p>
 *
 * @author Job Queue Team
 */
public class ScheduleTicker implements Closeable {
    private static final Logger logger = Logger.getLogger(ScheduleTicker.class.getName());

    private final ScheduledJobRepository scheduleRepository;
    private final JobModelRepository modelRepository;
    private final TaskQueue taskQueue;
    private final Clock clock;
    private final Duration tickInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    public ScheduleTicker(ScheduledJobRepository scheduleRepository, JobModelRepository modelRepository,
                          TaskQueue taskQueue, Clock clock, Duration tickInterval) {
        this.scheduleRepository = scheduleRepository;
        this.modelRepository = modelRepository;
        this.taskQueue = taskQueue;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    /**
     * Fire every schedule due at {@code now}.
     *
     * @return the number of tasks enqueued
     * @throws SQLException if the due schedules cannot be read
     */
    public int fireDueSchedules(Instant now) throws SQLException {
        List<ScheduledJob> due = scheduleRepository.findDue(now);
        int fired = 0;
        for (ScheduledJob schedule : due) {
            try {
                fire(schedule, now);
                fired++;
            } catch (ValidationException | RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to fire " + schedule, e);
            }
        }
        if (fired > 0) {
            logger.info("Fired " + fired + " scheduled jobs");
        }
        return fired;
    }

    private void fire(ScheduledJob schedule, Instant now) throws SQLException, ValidationException {
        QueuedTask.Builder task = QueuedTask.builder(schedule.getClassPath())
                .kwargs(JobKwargs.fromJson(schedule.getTaskKwargs()))
                .queueName(schedule.getTaskQueue())
                .user(schedule.getUserName())
                .scheduledJobId(schedule.getId());
        JobModel model = ClassPath.tryParse(schedule.getClassPath()).isPresent()
                ? modelRepository.findByClassPath(ClassPath.parse(schedule.getClassPath()))
                : null;
        if (model != null) {
            task.softTimeLimit(model.getSoftTimeLimit()).timeLimit(model.getTimeLimit());
        }

        // Compute the next run first so a bad crontab fails before anything is enqueued
        Instant nextRun = schedule.getInterval().isRecurring() ? nextRun(schedule, now) : null;

        String taskId = taskQueue.enqueue(task.build());
        logger.info("Scheduled job " + schedule.getId() + " fired as task " + taskId);

        if (nextRun == null) {
            scheduleRepository.delete(schedule.getId());
            return;
        }
        schedule.setLastRun(now);
        schedule.setTotalRunCount(schedule.getTotalRunCount() + 1);
        schedule.setNextRun(nextRun);
        scheduleRepository.save(schedule);
    }

    /**
     * Next fire time strictly after {@code now}. Missed periods are skipped, not replayed.
     */
    static Instant nextRun(ScheduledJob schedule, Instant now) throws ValidationException {
        if (schedule.getInterval() == JobExecutionType.CUSTOM) {
            return CronSchedules.nextFire(schedule.getCrontab(), now);
        }
        Instant next = schedule.getNextRun() != null ? schedule.getNextRun() : now;
        while (!next.isAfter(now)) {
            next = schedule.getInterval().nextAfter(next);
        }
        return next;
    }

    /**
     * Start ticking on a background thread.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Schedule ticker is already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor();
        executor.scheduleWithFixedDelay(this::tick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Schedule ticker started, checking every " + tickInterval.getSeconds() + " seconds");
    }

    private void tick() {
        try {
            fireDueSchedules(clock.instant());
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "SQLException in schedule ticker", e);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error in schedule ticker", e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Schedule ticker stopped");
    }
}
