package com.jobrunner.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.jobrunner.config.JobRunnerConfig;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobDisabledException;
import com.jobrunner.core.JobKwargs;
import com.jobrunner.core.JobLogEntry;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.JobResult;
import com.jobrunner.core.JobStatus;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;
import com.jobrunner.discovery.ExtensionJobSource;
import com.jobrunner.scheduling.ExecutionRequest;
import com.jobrunner.scheduling.JobExecutionType;
import com.jobrunner.scheduling.ScheduleSpec;
import com.jobrunner.scheduling.SubmitResult;
import com.jobrunner.vars.JobVariable;

import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * list                                   print the discovered jobs as JSON
 * enable &lt;class_path&gt;                  enable a job
 * disable &lt;class_path&gt;                 disable a job
 * run &lt;class_path&gt; [data_json] [options] submit a job
 *     --queue Q  --user U  --wait
 *     --schedule-name N  --schedule-interval I  --schedule-start ISO-8601  --schedule-crontab C
 * approve &lt;scheduled_job_id&gt; [--user U]   approve a pending run
 * serve                                  keep running and fire schedules until stopped
 * </pre>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    private static final String DEFAULT_USER = "admin";
    private static final long WAIT_POLL_MILLIS = 500;

    private static JobRunnerApplication application;

    public static void main(String[] args) {
        configureLogging();
        if (args.length == 0) {
            printUsage();
            System.exit(2);
        }

        logger.info("=== Job Runner Starting ===");
        int exitCode;
        try {
            // 1. Load configuration
            JobRunnerConfig config = JobRunnerConfig.load();

            // 2. Initialize application
            initializeApplication(config);

            // 3. Add shutdown hook for graceful shutdown
            addShutdownHook();

            // 4. Run the command
            exitCode = runCommand(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            exitCode = 2;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    private static void initializeApplication(JobRunnerConfig config) {
        try {
            ExtensionJobSource extensions = new ExtensionJobSource();
            int registered = extensions.registerServiceProviders(Main.class.getClassLoader());
            logger.info("Registered " + registered + " extension job modules");
            application = new JobRunnerApplication(config, extensions, List::of, Clock.systemUTC());
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to initialize application", e);
            throw new RuntimeException("Application initialization failed", e);
        }
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");
            shutdown();
        }, "shutdown-hook"));
        logger.info("Shutdown hook registered");
    }

    private static synchronized void shutdown() {
        if (application != null) {
            application.close();
            application = null;
        }
        logger.info("=== Job Runner Stopped ===");
    }

    private static int runCommand(String[] args) throws Exception {
        String command = args[0];
        switch (command) {
            case "list":
                listJobs();
                return 0;
            case "enable":
            case "disable":
                return setEnabled(requireArgument(args, 1, "class_path"), command.equals("enable"));
            case "run":
                return runJob(args);
            case "approve":
                return approve(args);
            case "serve":
                serve();
                return 0;
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static void listJobs() throws SQLException {
        List<Map<String, Object>> jobs = new ArrayList<>();
        for (JobDefinition definition : application.getDiscovery().current().getAllJobs()) {
            JobModel model = application.getCatalog().getModel(definition.getClassPath());
            Map<String, Object> job = new LinkedHashMap<>();
            job.put("class_path", definition.getClassPath().toString());
            job.put("name", model != null ? model.getName() : definition.getName());
            job.put("grouping", model != null ? model.getGrouping() : definition.getGrouping());
            job.put("kind", definition.getKind().name());
            job.put("enabled", model != null && model.isEnabled());
            List<Map<String, Object>> variables = new ArrayList<>();
            for (Map.Entry<String, JobVariable<?, ?>> entry : definition.getVariablesInFieldOrder().entrySet()) {
                variables.add(entry.getValue().describe(entry.getKey()));
            }
            job.put("variables", variables);
            jobs.add(job);
        }
        System.out.println(gson.toJson(jobs));
    }

    private static int setEnabled(String classPath, boolean enabled) throws SQLException {
        JobModel model = application.getCatalog().setEnabled(ClassPath.parse(classPath), enabled);
        System.out.println(model.getClassPath() + (model.isEnabled() ? " enabled" : " disabled"));
        return 0;
    }

    private static int runJob(String[] args) throws SQLException, InterruptedException {
        String classPath = requireArgument(args, 1, "class_path");
        Map<String, Object> data = new LinkedHashMap<>();
        String queue = null;
        String user = DEFAULT_USER;
        boolean wait = false;
        String scheduleName = null;
        String scheduleInterval = null;
        Instant scheduleStart = null;
        String scheduleCrontab = null;

        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--queue":
                    queue = requireArgument(args, ++i, "--queue");
                    break;
                case "--user":
                    user = requireArgument(args, ++i, "--user");
                    break;
                case "--wait":
                    wait = true;
                    break;
                case "--schedule-name":
                    scheduleName = requireArgument(args, ++i, "--schedule-name");
                    break;
                case "--schedule-interval":
                    scheduleInterval = requireArgument(args, ++i, "--schedule-interval");
                    break;
                case "--schedule-start":
                    scheduleStart = parseInstant(requireArgument(args, ++i, "--schedule-start"));
                    break;
                case "--schedule-crontab":
                    scheduleCrontab = requireArgument(args, ++i, "--schedule-crontab");
                    break;
                default:
                    if (args[i].startsWith("--") || i != 2) {
                        throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                    }
                    data = JobKwargs.fromJson(args[i]);
            }
        }

        ScheduleSpec schedule = null;
        if (scheduleInterval != null) {
            schedule = new ScheduleSpec(scheduleName, JobExecutionType.fromValue(scheduleInterval),
                    scheduleStart, scheduleCrontab);
        }

        SubmitResult result;
        try {
            result = application.getScheduler().submit(new ExecutionRequest(classPath, data, queue, schedule), user);
        } catch (ValidationException e) {
            System.err.println(gson.toJson(e.getErrors()));
            return 1;
        } catch (JobDisabledException e) {
            System.err.println(e.getMessage());
            return 1;
        }

        if (!result.isEnqueued()) {
            System.out.println(result.getScheduledJob());
            return 0;
        }
        System.out.println(result.getTaskId());
        if (!wait) {
            return 0;
        }

        JobResult jobResult = awaitResult(result.getTaskId());
        for (JobLogEntry entry : application.getResultRepository().getLogEntries(jobResult.getId())) {
            System.out.println(entry);
        }
        System.out.println(jobResult);
        return jobResult.getStatus() == JobStatus.SUCCESS ? 0 : 1;
    }

    private static JobResult awaitResult(String taskId) throws SQLException, InterruptedException {
        while (true) {
            JobResult result = application.getResultRepository().getResult(taskId);
            if (result != null && result.getStatus().isTerminal()) {
                return result;
            }
            Thread.sleep(WAIT_POLL_MILLIS);
        }
    }

    private static int approve(String[] args) throws SQLException {
        String id = requireArgument(args, 1, "scheduled_job_id");
        String user = DEFAULT_USER;
        if (args.length > 3 && args[2].equals("--user")) {
            user = args[3];
        }
        try {
            System.out.println(application.getScheduler().approve(id, user));
            return 0;
        } catch (ObjectNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        }
    }

    private static void serve() throws InterruptedException {
        application.start();
        logger.info("=== Job Runner is running ===");
        logger.info("Press Ctrl+C to stop");
        // Keep the main thread alive; the shutdown hook stops everything
        while (application != null && application.getTaskQueue().isRunning()) {
            Thread.sleep(1000);
        }
    }

    private static String requireArgument(String[] args, int index, String name) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + name);
        }
        return args[index];
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date and time: " + value);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: job-runner <list|enable|disable|run|approve|serve> [arguments]");
        System.err.println("  run <class_path> [data_json] [--queue Q] [--user U] [--wait]");
        System.err.println("      [--schedule-name N --schedule-interval I --schedule-start ISO --schedule-crontab C]");
    }
}
