package com.jobrunner.discovery;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for class loader reuse across rescans of a jobs directory.
 */
public class JarDirectoryJobSourceTest {

    @TempDir
    Path tempDir;

    private Path jobsRoot;
    private JarDirectoryJobSource source;

    @BeforeEach
    public void setUp() throws Exception {
        jobsRoot = Files.createDirectories(tempDir.resolve("jobs"));
        source = new JarDirectoryJobSource("local", jobsRoot);
    }

    @AfterEach
    public void tearDown() {
        source.close();
    }

    @Test
    public void testUnchangedJarKeepsItsClassLoader() throws Exception {
        JobDiscoveryTest.writeJar(jobsRoot.resolve("inventory.jar"), JobDiscoveryTest.InventoryModule.class.getName());

        for (int i = 0; i < 5; i++) {
            assertEquals(1, source.loadModules().size());
        }
        assertEquals(1, source.getOpenClassLoaderCount());
    }

    @Test
    public void testChangedJarRetiresItsOldClassLoader() throws Exception {
        Path jar = jobsRoot.resolve("inventory.jar");
        JobDiscoveryTest.writeJar(jar, JobDiscoveryTest.InventoryModule.class.getName());
        source.loadModules();

        JobDiscoveryTest.writeJar(jar, "# rebuilt", JobDiscoveryTest.InventoryModule.class.getName());
        assertEquals(1, source.loadModules().size());
        assertEquals(2, source.getOpenClassLoaderCount());

        source.loadModules();
        assertEquals(1, source.getOpenClassLoaderCount());
    }

    @Test
    public void testRemovedJarIsReleased() throws Exception {
        Path jar = jobsRoot.resolve("inventory.jar");
        JobDiscoveryTest.writeJar(jar, JobDiscoveryTest.InventoryModule.class.getName());
        source.loadModules();

        Files.delete(jar);
        assertTrue(source.loadModules().isEmpty());
        assertEquals(1, source.getOpenClassLoaderCount());

        source.loadModules();
        assertEquals(0, source.getOpenClassLoaderCount());
    }

    @Test
    public void testBrokenJarLeavesNoClassLoaderOpen() throws Exception {
        JobDiscoveryTest.writeJar(jobsRoot.resolve("broken.jar"), "com.example.DoesNotExist");

        assertTrue(source.loadModules().isEmpty());
        assertEquals(0, source.getOpenClassLoaderCount());
    }

    @Test
    public void testCloseReleasesEverything() throws Exception {
        JobDiscoveryTest.writeJar(jobsRoot.resolve("inventory.jar"), JobDiscoveryTest.InventoryModule.class.getName());
        source.loadModules();

        source.close();

        assertEquals(0, source.getOpenClassLoaderCount());
    }
}
