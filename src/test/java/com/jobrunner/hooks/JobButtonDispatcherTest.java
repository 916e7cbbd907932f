package com.jobrunner.hooks;

import com.jobrunner.Fixtures;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.DomainObject;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.InMemoryObjectRepository;
import com.jobrunner.core.JobContext;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.Database;
import com.jobrunner.db.JobHookRepository;
import com.jobrunner.db.JobModelRepository;
import com.jobrunner.db.ScheduledJobRepository;
import com.jobrunner.discovery.ExtensionJobSource;
import com.jobrunner.discovery.JobCatalog;
import com.jobrunner.discovery.JobDiscovery;
import com.jobrunner.engine.QueuedTask;
import com.jobrunner.scheduling.JobScheduler;
import com.jobrunner.scheduling.SubmitResult;
import com.jobrunner.vars.VariableServices;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JobButtonDispatcherTest {

    private static final String DEVICE = "dcim.device";
    private static final String REBOOT = "plugins/buttons/Reboot";

    private final List<QueuedTask> enqueued = new ArrayList<>();

    private Database database;
    private JobHookRepository repository;
    private JobButtonDispatcher dispatcher;

    @BeforeEach
    public void setUp() throws SQLException {
        database = Fixtures.newDatabase();
        repository = new JobHookRepository(database);
        JobModelRepository modelRepository = new JobModelRepository(database);
        InMemoryObjectRepository objects = new InMemoryObjectRepository();
        objects.save(new Fixtures.Item(DEVICE, "d1", "edge-01"));

        ExtensionJobSource extensions = new ExtensionJobSource();
        extensions.register(Fixtures.module("buttons",
                JobDefinition.builder("Reboot")
                        .parent(JobButtonReceiver.BASE_DEFINITION)
                        .factory(() -> new JobButtonReceiver() {
                            @Override
                            protected ExecutionOutcome receiveJobButton(JobContext context, DomainObject object) {
                                return ExecutionOutcome.success();
                            }
                        })
                        .build(),
                JobDefinition.builder("PlainJob")
                        .factory(() -> (context, data) -> ExecutionOutcome.success())
                        .build()));
        JobDiscovery discovery = new JobDiscovery(null, extensions, null, null, null);
        JobCatalog catalog = new JobCatalog(modelRepository);
        catalog.synchronize(discovery.discoverJobs());
        catalog.setEnabled(ClassPath.parse(REBOOT), true);

        JobScheduler scheduler = new JobScheduler(discovery, modelRepository, new ScheduledJobRepository(database),
                task -> {
                    enqueued.add(task);
                    return task.getTaskId();
                },
                new VariableServices(objects, new Fixtures.CountingFileStorage()),
                "default", Clock.systemUTC());
        dispatcher = new JobButtonDispatcher(repository, objects, scheduler, discovery);
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private JobButton registerReboot() throws Exception {
        JobButton button = new JobButton();
        button.setName("Reboot");
        button.setText("Reboot device");
        button.setClassPath(REBOOT);
        button.setContentTypes(List.of(DEVICE));
        dispatcher.registerButton(button);
        return button;
    }

    @Test
    public void testPressSubmitsObjectReference() throws Exception {
        JobButton button = registerReboot();

        SubmitResult result = dispatcher.press(button.getId(), "d1", DEVICE, "alice");

        assertTrue(result.isEnqueued());
        QueuedTask task = enqueued.get(0);
        assertEquals(REBOOT, task.getClassPath());
        assertEquals("alice", task.getUser());
        assertEquals(Map.of(JobButtonReceiver.OBJECT_PK, "d1", JobButtonReceiver.OBJECT_MODEL_NAME, DEVICE),
                task.getKwargs());
        assertEquals(1, repository.findButtonsForType(DEVICE).size());
    }

    @Test
    public void testPressOnMissingObject() throws Exception {
        JobButton button = registerReboot();

        assertThrows(ObjectNotFoundException.class, () -> dispatcher.press(button.getId(), "d9", DEVICE, "alice"));
        assertTrue(enqueued.isEmpty());
    }

    @Test
    public void testPressOnOtherType() throws Exception {
        JobButton button = registerReboot();

        ValidationException e = assertThrows(ValidationException.class,
                () -> dispatcher.press(button.getId(), "c1", "dcim.cable", "alice"));
        assertTrue(e.hasError("object_model_name"));
    }

    @Test
    public void testPressUnknownButton() {
        assertThrows(ObjectNotFoundException.class, () -> dispatcher.press("missing", "d1", DEVICE, "alice"));
    }

    @Test
    public void testRegisterButtonNeedsButtonReceiver() throws Exception {
        JobButton button = new JobButton();
        button.setName("Plain");
        button.setClassPath("plugins/buttons/PlainJob");

        ValidationException e = assertThrows(ValidationException.class, () -> dispatcher.registerButton(button));
        assertEquals(List.of("A job button must run a job button receiver"), e.getErrors().get("job"));
        assertEquals(List.of("This field is required."), e.getErrors().get("content_types"));
        assertTrue(repository.findButtonsForType(DEVICE).isEmpty());
    }
}
