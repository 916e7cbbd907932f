package com.jobrunner.db;

import com.jobrunner.Fixtures;
import com.jobrunner.core.JobLogEntry;
import com.jobrunner.core.JobResult;
import com.jobrunner.core.JobStatus;
import com.jobrunner.core.LogLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for result rows and their log entries.
 */
public class JobResultRepositoryTest {

    private Database database;
    private JobResultRepository repository;

    @BeforeEach
    public void setUp() throws SQLException {
        database = Fixtures.newDatabase();
        repository = new JobResultRepository(database);
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private JobResult pending(String id) throws SQLException {
        JobResult result = new JobResult();
        result.setId(id);
        result.setClassPath("plugins/tests/Echo");
        result.setJobName("Echo");
        result.setStatus(JobStatus.PENDING);
        result.setCreatedAt(Instant.now());
        result.setUserName("alice");
        repository.createResult(result);
        return result;
    }

    @Test
    public void testLifecycle() throws Exception {
        pending("task-1");

        assertTrue(repository.markRunning("task-1", Instant.now()));
        assertFalse(repository.markRunning("task-1", Instant.now()));
        assertTrue(repository.completeResult("task-1", JobStatus.SUCCESS, "{\"count\":3}", Instant.now()));

        JobResult stored = repository.getResult("task-1");
        assertEquals(JobStatus.SUCCESS, stored.getStatus());
        assertEquals("{\"count\":3}", stored.getResultJson());
        assertNotNull(stored.getStartedAt());
        assertNotNull(stored.getCompletedAt());
        assertEquals("alice", stored.getUserName());
    }

    @Test
    public void testResultIsCompletedOnce() throws Exception {
        pending("task-2");
        repository.markRunning("task-2", Instant.now());

        assertTrue(repository.completeResult("task-2", JobStatus.ERRORED, "{}", Instant.now()));
        assertFalse(repository.completeResult("task-2", JobStatus.SUCCESS, "{\"late\":true}", Instant.now()));

        JobResult stored = repository.getResult("task-2");
        assertEquals(JobStatus.ERRORED, stored.getStatus());
        assertNull(stored.getResultJson());
    }

    @Test
    public void testCompleteRequiresTerminalStatus() throws Exception {
        pending("task-3");

        assertThrows(IllegalArgumentException.class,
                () -> repository.completeResult("task-3", JobStatus.RUNNING, null, Instant.now()));
    }

    @Test
    public void testLogEntriesKeepTheirOrder() throws Exception {
        pending("task-4");
        repository.appendLogEntry(new JobLogEntry("task-4", LogLevel.INFO, "initialization", "Running job", null));
        repository.appendLogEntry(new JobLogEntry("task-4", LogLevel.WARNING, "run", "Slow device",
                new Fixtures.Item("dcim.device", "d1", "edge-01")));
        repository.appendLogEntry(new JobLogEntry("task-4", LogLevel.SUCCESS, "run", "Done", null));

        List<JobLogEntry> entries = repository.getLogEntries("task-4");
        assertEquals(List.of("Running job", "Slow device", "Done"), entries.stream().map(JobLogEntry::getMessage).toList());
        assertEquals("d1", entries.get(1).getObjectId());
        assertEquals("edge-01", entries.get(1).getObjectDisplay());
        assertEquals(LogLevel.SUCCESS, entries.get(2).getLevel());
    }

    @Test
    public void testMissingResult() throws Exception {
        assertNull(repository.getResult("nope"));
        assertTrue(repository.getLogEntries("nope").isEmpty());
    }

    @Test
    public void testResultsForClassPath() throws Exception {
        pending("task-5");
        pending("task-6");

        assertEquals(2, repository.getResultsForClassPath("plugins/tests/Echo").size());
        assertTrue(repository.getResultsForClassPath("plugins/tests/Other").isEmpty());
    }
}
