package com.jobrunner.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings of the job runner.
 *
 * <p>Values come from {@code jobrunner.properties} on the classpath; a JVM system property
 * with the same key overrides the file. Missing keys fall back to the defaults below.</p>
 *
 * <table>
 *   <caption>Keys</caption>
 *   <tr><td>jobrunner.database.url</td><td>JDBC URL of the H2 database</td></tr>
 *   <tr><td>jobrunner.jobs.root</td><td>directory scanned for local job jars</td></tr>
 *   <tr><td>jobrunner.git.root</td><td>directory holding repository clones</td></tr>
 *   <tr><td>jobrunner.task.queue.default</td><td>queue used when a job names none</td></tr>
 *   <tr><td>jobrunner.task.soft-time-limit-seconds</td><td>default soft time limit</td></tr>
 *   <tr><td>jobrunner.task.time-limit-seconds</td><td>default hard time limit</td></tr>
 * </table>
 */
public class JobRunnerConfig {
    private static final Logger logger = Logger.getLogger(JobRunnerConfig.class.getName());

    public static final String RESOURCE = "jobrunner.properties";

    public static final String DATABASE_URL = "jobrunner.database.url";
    public static final String DATABASE_USER = "jobrunner.database.user";
    public static final String DATABASE_PASSWORD = "jobrunner.database.password";
    public static final String JOBS_ROOT = "jobrunner.jobs.root";
    public static final String GIT_ROOT = "jobrunner.git.root";
    public static final String DEFAULT_QUEUE = "jobrunner.task.queue.default";
    public static final String QUEUE_CONCURRENCY = "jobrunner.task.queue.concurrency";
    public static final String SOFT_TIME_LIMIT = "jobrunner.task.soft-time-limit-seconds";
    public static final String TIME_LIMIT = "jobrunner.task.time-limit-seconds";
    public static final String SCHEDULER_TICK = "jobrunner.scheduler.tick-seconds";
    public static final String CHANGE_LOGGED_TYPES = "jobrunner.change-logged-types";

    private final Properties properties;

    public JobRunnerConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load the classpath resource and apply system property overrides.
     */
    public static JobRunnerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = JobRunnerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.warning(RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            logger.warning("Failed to read " + RESOURCE + ", using defaults: " + e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("jobrunner.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new JobRunnerConfig(properties);
    }

    public String getDatabaseUrl() {
        return get(DATABASE_URL, "jdbc:h2:./jobrunner;AUTO_SERVER=TRUE");
    }

    public String getDatabaseUser() {
        return get(DATABASE_USER, "sa");
    }

    public String getDatabasePassword() {
        return get(DATABASE_PASSWORD, "");
    }

    /**
     * @return the local jobs root, or null if not configured
     */
    public Path getJobsRoot() {
        String value = get(JOBS_ROOT, "");
        return value.isEmpty() ? null : Path.of(value);
    }

    /**
     * @return the Git clone root, or null if not configured
     */
    public Path getGitRoot() {
        String value = get(GIT_ROOT, "");
        return value.isEmpty() ? null : Path.of(value);
    }

    public String getDefaultQueue() {
        return get(DEFAULT_QUEUE, "default");
    }

    /**
     * Worker threads per task queue.
     */
    public int getQueueConcurrency() {
        return getInt(QUEUE_CONCURRENCY, 4);
    }

    public Duration getSoftTimeLimit() {
        return Duration.ofSeconds(getInt(SOFT_TIME_LIMIT, 300));
    }

    public Duration getTimeLimit() {
        return Duration.ofSeconds(getInt(TIME_LIMIT, 600));
    }

    public Duration getSchedulerTick() {
        return Duration.ofSeconds(getInt(SCHEDULER_TICK, 5));
    }

    /**
     * Object types whose changes are recorded and may trigger job hooks.
     */
    public List<String> getChangeLoggedTypes() {
        List<String> types = new ArrayList<>();
        for (String type : get(CHANGE_LOGGED_TYPES, "").split(",")) {
            if (!type.isBlank()) {
                types.add(type.trim());
            }
        }
        return types;
    }

    private String get(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue).trim();
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " must be an integer: " + value, e);
        }
    }
}
