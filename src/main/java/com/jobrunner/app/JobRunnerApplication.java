package com.jobrunner.app;

import com.jobrunner.changes.ChangeLogger;
import com.jobrunner.changes.ObjectChange;
import com.jobrunner.config.JobRunnerConfig;
import com.jobrunner.core.InMemoryObjectRepository;
import com.jobrunner.db.Database;
import com.jobrunner.db.DatabaseFileStorage;
import com.jobrunner.db.JobHookRepository;
import com.jobrunner.db.JobModelRepository;
import com.jobrunner.db.JobResultRepository;
import com.jobrunner.db.ScheduledJobRepository;
import com.jobrunner.discovery.ExtensionJobSource;
import com.jobrunner.discovery.GitCliSynchronizer;
import com.jobrunner.discovery.GitRepositoryCatalog;
import com.jobrunner.discovery.JobCatalog;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.discovery.JobRegistry;
import com.jobrunner.engine.ExecutorTaskQueue;
import com.jobrunner.engine.JobExecutor;
import com.jobrunner.hooks.ChangeLoggedTypes;
import com.jobrunner.hooks.JobButtonDispatcher;
import com.jobrunner.hooks.JobHookDispatcher;
import com.jobrunner.scheduling.JobScheduler;
import com.jobrunner.scheduling.ScheduleTicker;
import com.jobrunner.vars.VariableServices;

import java.io.Closeable;
import java.sql.SQLException;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the job runner together from a {@link JobRunnerConfig}.
 *
 * <p><b>Startup Sequence:</b></p>
 * <ol>
 *   <li>Open the database and create the schema</li>
 *   <li>Discover jobs and mirror them into job models</li>
 *   <li>Create the executor, task queue and scheduler</li>
 *   <li>Connect change logging to job hooks</li>
 * </ol>
 *
 * <p>Background threads (the schedule ticker) only run after {@link #start()}. Closing the
 * application stops them, waits for in-flight tasks and closes the database.</p>
 */
public class JobRunnerApplication implements Closeable {
    private static final Logger logger = Logger.getLogger(JobRunnerApplication.class.getName());

    private final Database database;
    private final JobResultRepository resultRepository;
    private final JobModelRepository modelRepository;
    private final ScheduledJobRepository scheduleRepository;
    private final JobHookRepository hookRepository;
    private final InMemoryObjectRepository objectRepository;
    private final DatabaseFileStorage fileStorage;
    private final JobDiscovery discovery;
    private final JobCatalog catalog;
    private final JobExecutor executor;
    private final ExecutorTaskQueue taskQueue;
    private final JobScheduler scheduler;
    private final ScheduleTicker ticker;
    private final ChangeLogger changeLogger;
    private final JobHookDispatcher hookDispatcher;
    private final JobButtonDispatcher buttonDispatcher;

    /**
     * Build every component and run discovery once.
     *
     * @param config settings
     * @param extensions job modules registered by extensions
     * @param gitCatalog repositories that may provide jobs
     * @param clock clock for timestamps and schedules
     * @throws SQLException if the database cannot be initialized
     */
    public JobRunnerApplication(JobRunnerConfig config, ExtensionJobSource extensions,
                                GitRepositoryCatalog gitCatalog, Clock clock) throws SQLException {
        logger.info("Initializing database...");
        database = new Database(config.getDatabaseUrl(), config.getDatabaseUser(), config.getDatabasePassword());
        database.initialize();
        resultRepository = new JobResultRepository(database);
        modelRepository = new JobModelRepository(database);
        scheduleRepository = new ScheduledJobRepository(database);
        hookRepository = new JobHookRepository(database);

        objectRepository = new InMemoryObjectRepository();
        objectRepository.registerType(ObjectChange.OBJECT_TYPE);
        fileStorage = new DatabaseFileStorage(database);
        VariableServices services = new VariableServices(objectRepository, fileStorage);

        logger.info("Discovering jobs...");
        discovery = new JobDiscovery(config.getJobsRoot(), extensions, gitCatalog, new GitCliSynchronizer(),
                config.getGitRoot());
        catalog = new JobCatalog(modelRepository);
        JobRegistry registry = discovery.discoverJobs();
        int created = catalog.synchronize(registry);
        logger.info("Job catalog synchronized, " + created + " new jobs (disabled until enabled)");

        executor = new JobExecutor(discovery, modelRepository, resultRepository, services, clock,
                config.getSoftTimeLimit(), config.getTimeLimit());
        taskQueue = new ExecutorTaskQueue(executor, config.getDefaultQueue(), config.getQueueConcurrency(), clock);
        scheduler = new JobScheduler(discovery, modelRepository, scheduleRepository, taskQueue, services,
                config.getDefaultQueue(), clock);
        ticker = new ScheduleTicker(scheduleRepository, modelRepository, taskQueue, clock, config.getSchedulerTick());

        changeLogger = new ChangeLogger(objectRepository::save, clock);
        ChangeLoggedTypes changeLoggedTypes = new ChangeLoggedTypes(config.getChangeLoggedTypes());
        hookDispatcher = new JobHookDispatcher(hookRepository, changeLoggedTypes, scheduler, discovery);
        changeLogger.addListener(hookDispatcher);
        buttonDispatcher = new JobButtonDispatcher(hookRepository, objectRepository, scheduler, discovery);

        logger.info("Job runner initialized");
    }

    /**
     * Start firing schedules.
     */
    public void start() {
        ticker.start();
    }

    /**
     * Rescan every source and update the job models.
     *
     * @throws SQLException if the models cannot be updated
     */
    public JobRegistry refreshJobs() throws SQLException {
        JobRegistry registry = discovery.refresh();
        catalog.synchronize(registry);
        return registry;
    }

    public Database getDatabase() {
        return database;
    }

    public JobResultRepository getResultRepository() {
        return resultRepository;
    }

    public JobModelRepository getModelRepository() {
        return modelRepository;
    }

    public ScheduledJobRepository getScheduleRepository() {
        return scheduleRepository;
    }

    public JobHookRepository getHookRepository() {
        return hookRepository;
    }

    public InMemoryObjectRepository getObjectRepository() {
        return objectRepository;
    }

    public DatabaseFileStorage getFileStorage() {
        return fileStorage;
    }

    public JobDiscovery getDiscovery() {
        return discovery;
    }

    public JobCatalog getCatalog() {
        return catalog;
    }

    public JobExecutor getExecutor() {
        return executor;
    }

    public ExecutorTaskQueue getTaskQueue() {
        return taskQueue;
    }

    public JobScheduler getScheduler() {
        return scheduler;
    }

    public ScheduleTicker getTicker() {
        return ticker;
    }

    public ChangeLogger getChangeLogger() {
        return changeLogger;
    }

    public JobHookDispatcher getHookDispatcher() {
        return hookDispatcher;
    }

    public JobButtonDispatcher getButtonDispatcher() {
        return buttonDispatcher;
    }

    @Override
    public void close() {
        logger.info("Shutting down job runner...");
        try {
            ticker.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error stopping schedule ticker", e);
        }
        try {
            taskQueue.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error shutting down task queue", e);
        }
        discovery.close();
        database.close();
        logger.info("Job runner stopped");
    }
}
