package com.jobrunner.scheduling;

import com.jobrunner.Fixtures;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.InMemoryObjectRepository;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobDisabledException;
import com.jobrunner.core.JobKwargs;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.Database;
import com.jobrunner.db.JobModelRepository;
import com.jobrunner.db.ScheduledJobRepository;
import com.jobrunner.discovery.ExtensionJobSource;
import com.jobrunner.discovery.JobCatalog;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.engine.QueuedTask;
import com.jobrunner.vars.IntegerVar;
import com.jobrunner.vars.StringVar;
import com.jobrunner.vars.VariableServices;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for run submission: input validation, queue selection, approvals and schedules.
 */
public class JobSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final List<QueuedTask> enqueued = new ArrayList<>();

    private Database database;
    private JobModelRepository modelRepository;
    private ScheduledJobRepository scheduleRepository;
    private JobCatalog catalog;
    private JobScheduler scheduler;

    @BeforeEach
    public void setUp() throws SQLException {
        database = Fixtures.newDatabase();
        modelRepository = new JobModelRepository(database);
        scheduleRepository = new ScheduledJobRepository(database);

        ExtensionJobSource extensions = new ExtensionJobSource();
        extensions.register(Fixtures.module("tests",
                JobDefinition.builder("Echo")
                        .hasSensitiveVariables(false)
                        .variable("message", new StringVar())
                        .variable("count", new IntegerVar().defaultValue(1))
                        .taskQueues(List.of("default", "priority"))
                        .factory(() -> (context, data) -> ExecutionOutcome.success())
                        .build(),
                JobDefinition.builder("Secret")
                        .variable("password", new StringVar())
                        .factory(() -> (context, data) -> ExecutionOutcome.success())
                        .build(),
                JobDefinition.builder("Guarded")
                        .hasSensitiveVariables(false)
                        .approvalRequired(true)
                        .factory(() -> (context, data) -> ExecutionOutcome.success())
                        .build(),
                JobDefinition.builder("Dormant")
                        .factory(() -> (context, data) -> ExecutionOutcome.success())
                        .build()));
        JobDiscovery discovery = new JobDiscovery(null, extensions, null, null, null);
        catalog = new JobCatalog(modelRepository);
        catalog.synchronize(discovery.discoverJobs());
        for (String name : List.of("Echo", "Secret", "Guarded")) {
            catalog.setEnabled(ClassPath.parse("plugins/tests/" + name), true);
        }

        scheduler = new JobScheduler(discovery, modelRepository, scheduleRepository,
                task -> {
                    enqueued.add(task);
                    return task.getTaskId();
                },
                new VariableServices(new InMemoryObjectRepository(), new Fixtures.CountingFileStorage()),
                "default", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private static Map<String, Object> data(Object... pairs) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            data.put((String) pairs[i], pairs[i + 1]);
        }
        return data;
    }

    @Test
    public void testImmediateRunIsEnqueued() throws Exception {
        SubmitResult result = scheduler.submit(
                ExecutionRequest.of("plugins/tests/Echo", data("message", "hi")), "alice");

        assertTrue(result.isEnqueued());
        assertEquals(1, enqueued.size());
        QueuedTask task = enqueued.get(0);
        assertEquals(result.getTaskId(), task.getTaskId());
        assertEquals("plugins/tests/Echo", task.getClassPath());
        assertEquals("alice", task.getUser());
        assertEquals("default", task.getQueueName());
        assertEquals(Map.of("message", "hi", "count", 1), task.getKwargs());
        assertTrue(scheduleRepository.findAll().isEmpty());
    }

    @Test
    public void testUnknownPropertyIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                ExecutionRequest.of("plugins/tests/Echo", data("message", "hi", "colour", "red")), "alice"));

        assertEquals(List.of("Job data contained an unknown property"), e.getErrors().get("colour"));
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testInvalidInputIsKeyedByVariable() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                ExecutionRequest.of("plugins/tests/Echo", data("count", "many")), "alice"));

        assertTrue(e.hasError("message"));
        assertEquals(List.of("Enter a whole number."), e.getErrors().get("count"));
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testUnknownJobFailsOnClassPath() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                ExecutionRequest.of("plugins/tests/Missing", Map.of()), "alice"));

        assertTrue(e.hasError("class_path"));
    }

    @Test
    public void testDisabledJobIsRejected() {
        JobDisabledException e = assertThrows(JobDisabledException.class, () -> scheduler.submit(
                ExecutionRequest.of("plugins/tests/Dormant", Map.of()), "alice"));

        assertEquals("plugins/tests/Dormant", e.getClassPath());
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testInconsistentPolicyIsRejected() throws Exception {
        JobModel model = catalog.getModel(ClassPath.parse("plugins/tests/Secret"));
        model.setApprovalRequired(true);
        model.setApprovalRequiredOverride(true);
        modelRepository.save(model);

        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                ExecutionRequest.of("plugins/tests/Secret", data("password", "hunter2")), "alice"));

        assertTrue(e.hasError("approval_required"));
        assertTrue(e.hasError("has_sensitive_variables"));
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testTaskQueueResolution() throws Exception {
        JobModel echo = catalog.getModel(ClassPath.parse("plugins/tests/Echo"));
        JobModel secret = catalog.getModel(ClassPath.parse("plugins/tests/Secret"));

        assertEquals("priority", scheduler.resolveTaskQueue(echo, "priority"));
        assertEquals("default", scheduler.resolveTaskQueue(echo, "elsewhere"));
        assertEquals("default", scheduler.resolveTaskQueue(secret, "elsewhere"));

        scheduler.submit(new ExecutionRequest("plugins/tests/Echo", data("message", "hi"), "priority", null), "alice");
        assertEquals("priority", enqueued.get(0).getQueueName());
    }

    @Test
    public void testApprovalRequiredCreatesPendingSchedule() throws Exception {
        SubmitResult result = scheduler.submit(ExecutionRequest.of("plugins/tests/Guarded", Map.of()), "alice");

        assertFalse(result.isEnqueued());
        assertTrue(enqueued.isEmpty());
        ScheduledJob pending = result.getScheduledJob();
        assertEquals(JobExecutionType.IMMEDIATELY, pending.getInterval());
        assertTrue(pending.isApprovalRequired());
        assertFalse(pending.isApproved());
        assertEquals(1, scheduleRepository.findPendingApproval().size());
        assertTrue(scheduleRepository.findDue(NOW.plusSeconds(60)).isEmpty());

        ScheduledJob approved = scheduler.approve(pending.getId(), "bob");
        assertEquals("bob", approved.getApprovedBy());
        assertTrue(scheduleRepository.findPendingApproval().isEmpty());
        assertEquals(1, scheduleRepository.findDue(NOW).size());
    }

    @Test
    public void testApproveUnknownScheduleThrows() {
        assertThrows(ObjectNotFoundException.class, () -> scheduler.approve("nope", "bob"));
    }

    @Test
    public void testFutureRunIsPersisted() throws Exception {
        Instant start = NOW.plus(Duration.ofHours(2));
        SubmitResult result = scheduler.submit(new ExecutionRequest("plugins/tests/Echo", data("message", "later"),
                null, ScheduleSpec.at("Later", start)), "alice");

        ScheduledJob scheduled = scheduleRepository.findById(result.getScheduledJob().getId());
        assertEquals("Later", scheduled.getName());
        assertEquals(JobExecutionType.FUTURE, scheduled.getInterval());
        assertEquals(start, scheduled.getNextRun());
        assertEquals(Map.of("message", "later", "count", 1), JobKwargs.fromJson(scheduled.getTaskKwargs()));
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testStartTimeInThePastIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                new ExecutionRequest("plugins/tests/Echo", data("message", "hi"), null,
                        ScheduleSpec.every("Hourly", JobExecutionType.HOURLY, NOW.minusSeconds(1))), "alice"));

        assertTrue(e.hasError("start_time"));
    }

    @Test
    public void testScheduleNeedsAName() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                new ExecutionRequest("plugins/tests/Echo", data("message", "hi"), null,
                        ScheduleSpec.at(" ", NOW.plusSeconds(60))), "alice"));

        assertTrue(e.hasError("name"));
    }

    @Test
    public void testCustomScheduleNeedsCrontab() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                new ExecutionRequest("plugins/tests/Echo", data("message", "hi"), null,
                        ScheduleSpec.cron("Nightly", null)), "alice"));

        assertTrue(e.hasError("crontab"));
    }

    @Test
    public void testCustomScheduleStartsAtFirstMatch() throws Exception {
        SubmitResult result = scheduler.submit(new ExecutionRequest("plugins/tests/Echo", data("message", "hi"),
                null, ScheduleSpec.cron("Every five", "*/5 * * * *")), "alice");

        ScheduledJob scheduled = result.getScheduledJob();
        assertEquals("*/5 * * * *", scheduled.getCrontab());
        assertEquals(CronSchedules.nextFire("*/5 * * * *", NOW), scheduled.getNextRun());
        assertTrue(scheduled.getNextRun().isAfter(NOW));
    }

    @Test
    public void testSensitiveJobCannotBeScheduled() {
        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.submit(
                new ExecutionRequest("plugins/tests/Secret", data("password", "hunter2"), null,
                        ScheduleSpec.at("Later", NOW.plusSeconds(60))), "alice"));

        assertTrue(e.hasError("schedule"));
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testCancelDeletesSchedule() throws Exception {
        SubmitResult result = scheduler.submit(new ExecutionRequest("plugins/tests/Echo", data("message", "hi"),
                null, ScheduleSpec.at("Later", NOW.plusSeconds(60))), "alice");

        assertTrue(scheduler.cancel(result.getScheduledJob().getId()));
        assertFalse(scheduler.cancel(result.getScheduledJob().getId()));
        assertTrue(scheduleRepository.findAll().isEmpty());
    }
}
