package com.jobrunner.discovery;

import com.jobrunner.Fixtures;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.DiscoverySourceException;
import com.jobrunner.core.ExecutionOutcome;
import com.jobrunner.core.JobDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for scanning local, Git and extension sources into one snapshot.
 */
public class JobDiscoveryTest {

    /**
     * Module named in the service files of the jars built by these tests.
     */
    public static class InventoryModule implements JobModule {

        @Override
        public String getModuleName() {
            return "inventory";
        }

        @Override
        public String getDisplayName() {
            return "Inventory Jobs";
        }

        @Override
        public List<JobDefinition> getJobDefinitions() {
            return List.of(JobDefinition.builder("Audit")
                    .factory(() -> (context, data) -> ExecutionOutcome.success())
                    .build());
        }
    }

    @TempDir
    Path tempDir;

    private final List<JobDiscovery> opened = new ArrayList<>();

    @AfterEach
    public void tearDown() {
        opened.forEach(JobDiscovery::close);
    }

    private JobDiscovery open(JobDiscovery discovery) {
        opened.add(discovery);
        return discovery;
    }

    static void writeJar(Path jar, String... serviceLines) throws IOException {
        Files.createDirectories(jar.getParent());
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            out.putNextEntry(new JarEntry(JarDirectoryJobSource.SERVICE_RESOURCE));
            out.write((String.join("\n", serviceLines) + "\n").getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
    }

    /**
     * Pretends to clone: creates the .git directory and a jobs jar.
     */
    private static GitSynchronizer fakeClone() {
        return (repository, clonePath) -> {
            try {
                Files.createDirectories(clonePath.resolve(".git"));
                writeJar(clonePath.resolve("jobs").resolve("jobs.jar"), InventoryModule.class.getName());
            } catch (IOException e) {
                throw new DiscoverySourceException(ClassPath.gitSourceGrouping(repository.getSlug()), "Clone failed", e);
            }
        };
    }

    @Test
    public void testLocalJarsAreDiscovered() throws Exception {
        Path jobsRoot = tempDir.resolve("jobs");
        writeJar(jobsRoot.resolve("inventory.jar"), "# job modules", InventoryModule.class.getName());

        JobDiscovery discovery = open(new JobDiscovery(jobsRoot, null, null, null, null));
        JobRegistry registry = discovery.discoverJobs();

        assertTrue(registry.contains("local/inventory/Audit"));
        assertNotNull(discovery.getJob("local/inventory/Audit"));
        assertEquals("Inventory Jobs", registry.getModuleDisplayName(
                ClassPath.parse("local/inventory/Audit")));
    }

    @Test
    public void testBrokenJarIsSkipped() throws Exception {
        Path jobsRoot = tempDir.resolve("jobs");
        writeJar(jobsRoot.resolve("broken.jar"), "com.example.DoesNotExist");
        writeJar(jobsRoot.resolve("inventory.jar"), InventoryModule.class.getName());

        JobDiscovery discovery = open(new JobDiscovery(jobsRoot, null, null, null, null));

        assertEquals(1, discovery.discoverJobs().getClassPaths().size());
    }

    @Test
    public void testGetJobHandlesMalformedAndUnknownPaths() {
        ExtensionJobSource extensions = new ExtensionJobSource();
        extensions.register(Fixtures.module("tests", JobDefinition.builder("Echo")
                .factory(() -> (context, data) -> ExecutionOutcome.success())
                .build()));
        JobDiscovery discovery = open(new JobDiscovery(null, extensions, null, null, null));

        assertNotNull(discovery.getJob("plugins/tests/Echo"));
        assertNull(discovery.getJob("plugins/tests/Missing"));
        assertNull(discovery.getJob("not-a-class-path"));
        assertEquals(1, discovery.listClassPaths().size());
    }

    @Test
    public void testDefinitionsWithoutImplementationAreSkipped() {
        ExtensionJobSource extensions = new ExtensionJobSource();
        extensions.register(Fixtures.module("tests", JobDefinition.builder("Abstract").build()));
        JobDiscovery discovery = open(new JobDiscovery(null, extensions, null, null, null));

        assertFalse(discovery.discoverJobs().contains("plugins/tests/Abstract"));
    }

    @Test
    public void testGitRepositoriesProvideJobs() throws Exception {
        Path gitRoot = Files.createDirectories(tempDir.resolve("git"));
        GitRepositoryCatalog catalog = () -> List.of(
                new GitRepositoryRecord("netops", "https://git.example.com/netops.git", "main", "abc123", true),
                new GitRepositoryRecord("configs", "https://git.example.com/configs.git", "main", "def456", false));

        JobDiscovery discovery = open(new JobDiscovery(null, null, catalog, fakeClone(), gitRoot));
        JobRegistry registry = discovery.discoverJobs();

        assertEquals(List.of("git.netops/inventory/Audit"), new ArrayList<>(registry.getClassPaths()));
        assertTrue(discovery.getJob("git.netops/inventory/Audit").getClassPath().isFromGit());
        assertFalse(Files.exists(gitRoot.resolve("configs")));
    }

    @Test
    public void testFailedCloneSkipsOnlyThatRepository() throws Exception {
        Path gitRoot = Files.createDirectories(tempDir.resolve("git"));
        GitRepositoryCatalog catalog = () -> List.of(
                new GitRepositoryRecord("broken", "https://git.example.com/broken.git", "main", "abc123", true),
                new GitRepositoryRecord("netops", "https://git.example.com/netops.git", "main", "abc123", true));
        GitSynchronizer clone = fakeClone();
        GitSynchronizer flaky = (repository, clonePath) -> {
            if (repository.getSlug().equals("broken")) {
                throw new DiscoverySourceException("git.broken", "Remote unreachable");
            }
            clone.ensureSynchronized(repository, clonePath);
        };

        ExtensionJobSource extensions = new ExtensionJobSource();
        extensions.register(Fixtures.module("tests", JobDefinition.builder("Echo")
                .factory(() -> (context, data) -> ExecutionOutcome.success())
                .build()));
        JobDiscovery discovery = open(new JobDiscovery(null, extensions, catalog, flaky, gitRoot));

        JobRegistry registry = discovery.discoverJobs();
        assertTrue(registry.contains("git.netops/inventory/Audit"));
        assertTrue(registry.contains("plugins/tests/Echo"));
        assertEquals(2, registry.getClassPaths().size());
    }

    @Test
    public void testOrphanedClonesAreDeleted() throws Exception {
        Path gitRoot = Files.createDirectories(tempDir.resolve("git"));
        Path orphan = Files.createDirectories(gitRoot.resolve("retired").resolve(".git"));
        Files.writeString(orphan.resolve("HEAD"), "ref: refs/heads/main\n");
        Path notAClone = Files.createDirectories(gitRoot.resolve("scratch"));
        Path stray = Files.writeString(gitRoot.resolve("notes.txt"), "leftover");

        JobDiscovery discovery = open(new JobDiscovery(null, null, List::of, fakeClone(), gitRoot));
        discovery.discoverJobs();

        assertFalse(Files.exists(gitRoot.resolve("retired")));
        assertTrue(Files.isDirectory(notAClone));
        assertTrue(Files.exists(stray));
    }

    @Test
    public void testRefreshPicksUpNewJars() throws Exception {
        Path jobsRoot = Files.createDirectories(tempDir.resolve("jobs"));
        JobDiscovery discovery = open(new JobDiscovery(jobsRoot, null, null, null, null));
        assertTrue(discovery.current().getClassPaths().isEmpty());

        writeJar(jobsRoot.resolve("inventory.jar"), InventoryModule.class.getName());

        assertTrue(discovery.current().getClassPaths().isEmpty());
        assertTrue(discovery.refresh().contains("local/inventory/Audit"));
        assertTrue(discovery.current().contains("local/inventory/Audit"));
    }
}
