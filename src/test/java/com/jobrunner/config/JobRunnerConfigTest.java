package com.jobrunner.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class JobRunnerConfigTest {

    @Test
    public void testDefaults() {
        JobRunnerConfig config = new JobRunnerConfig(new Properties());

        assertEquals("default", config.getDefaultQueue());
        assertEquals(4, config.getQueueConcurrency());
        assertEquals(Duration.ofSeconds(300), config.getSoftTimeLimit());
        assertEquals(Duration.ofSeconds(600), config.getTimeLimit());
        assertNull(config.getJobsRoot());
        assertNull(config.getGitRoot());
        assertTrue(config.getChangeLoggedTypes().isEmpty());
    }

    @Test
    public void testExplicitValues() {
        Properties properties = new Properties();
        properties.setProperty(JobRunnerConfig.JOBS_ROOT, "/srv/jobs ");
        properties.setProperty(JobRunnerConfig.DEFAULT_QUEUE, "celery");
        properties.setProperty(JobRunnerConfig.TIME_LIMIT, " 30");
        properties.setProperty(JobRunnerConfig.CHANGE_LOGGED_TYPES, "dcim.device, ,ipam.prefix");
        JobRunnerConfig config = new JobRunnerConfig(properties);

        assertEquals(Path.of("/srv/jobs"), config.getJobsRoot());
        assertEquals("celery", config.getDefaultQueue());
        assertEquals(Duration.ofSeconds(30), config.getTimeLimit());
        assertEquals(List.of("dcim.device", "ipam.prefix"), config.getChangeLoggedTypes());
    }

    @Test
    public void testMalformedIntegerIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(JobRunnerConfig.QUEUE_CONCURRENCY, "four");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new JobRunnerConfig(properties).getQueueConcurrency());
        assertTrue(e.getMessage().contains(JobRunnerConfig.QUEUE_CONCURRENCY));
    }

    @Test
    public void testLoadReadsBundledResource() {
        JobRunnerConfig config = JobRunnerConfig.load();

        assertFalse(config.getChangeLoggedTypes().isEmpty());
        assertEquals(Duration.ofSeconds(5), config.getSchedulerTick());
    }
}
