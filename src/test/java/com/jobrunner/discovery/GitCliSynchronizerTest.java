package com.jobrunner.discovery;

import com.jobrunner.core.DiscoverySourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for cloning and updating against a local bare repository.
 */
public class GitCliSynchronizerTest {

    @TempDir
    Path tempDir;

    private Path work;
    private Path remote;
    private Path gitRoot;
    private GitCliSynchronizer synchronizer;

    @BeforeEach
    public void setUp() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");

        work = Files.createDirectories(tempDir.resolve("work"));
        git(work, "init");
        git(work, "symbolic-ref", "HEAD", "refs/heads/main");
        commit("first");

        remote = tempDir.resolve("remote.git");
        git(tempDir, "clone", "--bare", work.toString(), remote.toString());

        gitRoot = Files.createDirectories(tempDir.resolve("git"));
        synchronizer = new GitCliSynchronizer("git", Duration.ofSeconds(60));
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String git(Path directory, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(List.of("git", "-c", "user.name=Test", "-c", "user.email=test@example.com"));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command)
                .directory(directory.toFile())
                .redirectErrorStream(true)
                .start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertTrue(process.waitFor(30, TimeUnit.SECONDS), "git " + args[0] + " timed out");
        assertEquals(0, process.exitValue(), "git " + String.join(" ", args) + " failed: " + output);
        return output.trim();
    }

    private String commit(String message) throws IOException, InterruptedException {
        Files.createDirectories(work.resolve("jobs"));
        Files.writeString(work.resolve("jobs").resolve("README"), message + "\n");
        git(work, "add", "-A");
        git(work, "commit", "-m", message);
        return git(work, "rev-parse", "HEAD");
    }

    private GitRepositoryRecord record(String head) {
        return new GitRepositoryRecord("netops", remote.toString(), "main", head, true);
    }

    private String headOf(Path clone) throws IOException, InterruptedException {
        return git(clone, "rev-parse", "HEAD");
    }

    @Test
    public void testCloneReachesRecordedHead() throws Exception {
        String head = git(work, "rev-parse", "HEAD");
        Path clone = gitRoot.resolve("netops");

        synchronizer.ensureSynchronized(record(head), clone);

        assertTrue(Files.isDirectory(clone.resolve(".git")));
        assertTrue(Files.exists(clone.resolve("jobs").resolve("README")));
        assertEquals(head, headOf(clone));
    }

    @Test
    public void testResyncAtRecordedHeadIsNoOp() throws Exception {
        String head = git(work, "rev-parse", "HEAD");
        Path clone = gitRoot.resolve("netops");
        synchronizer.ensureSynchronized(record(head), clone);

        // Without a remote, anything beyond the head check would fail
        git(clone, "remote", "set-url", "origin", tempDir.resolve("missing.git").toString());
        synchronizer.ensureSynchronized(record(head), clone);

        assertEquals(head, headOf(clone));
    }

    @Test
    public void testNewHeadIsFetchedAndCheckedOut() throws Exception {
        String first = git(work, "rev-parse", "HEAD");
        Path clone = gitRoot.resolve("netops");
        synchronizer.ensureSynchronized(record(first), clone);

        String second = commit("second");
        git(work, "push", remote.toString(), "main");
        synchronizer.ensureSynchronized(record(second), clone);

        assertEquals(second, headOf(clone));
        assertEquals("second", Files.readString(clone.resolve("jobs").resolve("README")).trim());
    }

    @Test
    public void testConcurrentSynchronizationSucceedsForBothCallers() throws Exception {
        String head = git(work, "rev-parse", "HEAD");
        Path clone = gitRoot.resolve("netops");
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> calls = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                calls.add(pool.submit(() -> {
                    start.await();
                    synchronizer.ensureSynchronized(record(head), clone);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> call : calls) {
                call.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(head, headOf(clone));
    }

    @Test
    public void testUnreachableRemoteFails() {
        GitRepositoryRecord missing = new GitRepositoryRecord("ghost", tempDir.resolve("ghost.git").toString(),
                "main", null, true);

        DiscoverySourceException e = assertThrows(DiscoverySourceException.class,
                () -> synchronizer.ensureSynchronized(missing, gitRoot.resolve("ghost")));

        assertEquals("git.ghost", e.getSourceGrouping());
        assertFalse(Files.exists(gitRoot.resolve("ghost").resolve(".git")));
    }

    @Test
    public void testHungCommandTimesOut() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path hanging = tempDir.resolve("hanging-git");
        Files.writeString(hanging, "#!/bin/sh\nsleep 30\n");
        Files.setPosixFilePermissions(hanging, PosixFilePermissions.fromString("rwxr-xr-x"));
        GitCliSynchronizer stuck = new GitCliSynchronizer(hanging.toString(), Duration.ofMillis(500));

        long started = System.nanoTime();
        DiscoverySourceException e = assertThrows(DiscoverySourceException.class,
                () -> stuck.ensureSynchronized(record(null), gitRoot.resolve("netops")));

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(20)) < 0);
    }
}
