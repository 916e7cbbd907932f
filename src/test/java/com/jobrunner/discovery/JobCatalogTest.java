package com.jobrunner.discovery;

import com.jobrunner.Fixtures;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.JobDefinition;
import com.jobrunner.core.JobModel;
import com.jobrunner.core.ValidationException;
import com.jobrunner.db.Database;
import com.jobrunner.db.JobModelRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobCatalogTest {

    private static final ClassPath BACKUP = ClassPath.parse("plugins/ops/Backup");
    private static final ClassPath CLEANUP = ClassPath.parse("plugins/ops/Cleanup");

    private Database database;
    private JobModelRepository repository;
    private JobCatalog catalog;

    @BeforeEach
    public void setUp() throws SQLException {
        database = Fixtures.newDatabase();
        repository = new JobModelRepository(database);
        catalog = new JobCatalog(repository);
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private static JobRegistry registry(JobDefinition... definitions) {
        return JobRegistry.builder().addModule(ClassPath.PLUGINS, Fixtures.module("ops", definitions)).build();
    }

    private static JobDefinition job(String name, String description) {
        return JobDefinition.builder(name)
                .description(description)
                .hasSensitiveVariables(false)
                .taskQueues(List.of("default"))
                .factory(() -> (context, data) -> ExecutionOutcome.success())
                .build();
    }

    @Test
    public void testNewModelsAreCreatedDisabled() throws Exception {
        assertEquals(2, catalog.synchronize(registry(job("Backup", "Back up configs"), job("Cleanup", "Prune"))));

        JobModel model = catalog.getModel(BACKUP);
        assertTrue(model.isInstalled());
        assertFalse(model.isEnabled());
        assertEquals("Back up configs", model.getDescription());
        assertEquals("ops", model.getGrouping());
        assertEquals(List.of("default"), model.getTaskQueues());
        assertEquals(2, repository.findAll().size());
    }

    @Test
    public void testResyncKeepsOverridesAndEnabledFlag() throws Exception {
        catalog.synchronize(registry(job("Backup", "Back up configs")));
        JobModel model = catalog.setEnabled(BACKUP, true);
        model.setName("Nightly backup");
        model.setNameOverride(true);
        catalog.saveModel(model);

        assertEquals(0, catalog.synchronize(registry(job("Backup", "Back up device configs"))));

        JobModel resynced = catalog.getModel(BACKUP);
        assertTrue(resynced.isEnabled());
        assertEquals("Nightly backup", resynced.getName());
        assertEquals("Back up device configs", resynced.getDescription());
    }

    @Test
    public void testMissingJobsAreMarkedNotInstalled() throws Exception {
        catalog.synchronize(registry(job("Backup", ""), job("Cleanup", "")));
        catalog.setEnabled(CLEANUP, true);

        catalog.synchronize(registry(job("Backup", "")));

        JobModel removed = catalog.getModel(CLEANUP);
        assertFalse(removed.isInstalled());
        assertFalse(removed.isEnabled());
        assertTrue(catalog.getModel(BACKUP).isInstalled());
    }

    @Test
    public void testSaveModelChecksPolicy() throws Exception {
        catalog.synchronize(registry(job("Backup", "")));
        JobModel model = catalog.getModel(BACKUP);
        model.setTimeLimit(Duration.ofSeconds(-1));
        model.setTimeLimitOverride(true);

        ValidationException e = assertThrows(ValidationException.class, () -> catalog.saveModel(model));
        assertTrue(e.hasError("time_limit"));
        assertEquals(Duration.ZERO, catalog.getModel(BACKUP).getTimeLimit());
    }

    @Test
    public void testSetEnabledRequiresModel() {
        assertThrows(IllegalArgumentException.class, () -> catalog.setEnabled(BACKUP, true));
    }
}
