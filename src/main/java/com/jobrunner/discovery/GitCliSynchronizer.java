package com.jobrunner.discovery;

import com.jobrunner.core.DiscoverySourceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link GitSynchronizer} that runs the {@code git} command line tool.
 *
 * <ul>
 *   <li>No clone yet: clone the configured branch.</li>
 *   <li>Clone already at the recorded head: nothing to do.</li>
 *   <li>Otherwise: fetch, then force checkout of the recorded head (or the branch tip).</li>
 * </ul>
 *
 * <p>A clone that fails because another process created the directory meanwhile is treated
 * as cloned, and the head check runs as usual. Within one process, calls for the same clone
 * path are serialized.</p>
 *
 * <p>Every command runs with a timeout and with terminal prompts disabled, so a remote asking
 * for credentials fails the sync instead of blocking discovery. Output goes to a temporary
 * file that is read once the command has exited.</p>
 */
public class GitCliSynchronizer implements GitSynchronizer {
    private static final Logger logger = Logger.getLogger(GitCliSynchronizer.class.getName());

    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(300);

    private final String gitExecutable;
    private final Duration commandTimeout;
    private final Map<Path, Object> cloneLocks = new ConcurrentHashMap<>();

    public GitCliSynchronizer() {
        this("git", DEFAULT_COMMAND_TIMEOUT);
    }

    public GitCliSynchronizer(String gitExecutable, Duration commandTimeout) {
        this.gitExecutable = gitExecutable;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public void ensureSynchronized(GitRepositoryRecord repository, Path clonePath) throws DiscoverySourceException {
        Object lock = cloneLocks.computeIfAbsent(clonePath.toAbsolutePath().normalize(), path -> new Object());
        synchronized (lock) {
            synchronize(repository, clonePath);
        }
    }

    private void synchronize(GitRepositoryRecord repository, Path clonePath) throws DiscoverySourceException {
        String grouping = "git." + repository.getSlug();

        if (!Files.isDirectory(clonePath.resolve(".git"))) {
            logger.info("Cloning " + repository.getRemoteUrl() + " into " + clonePath);
            CommandResult clone = run(grouping, clonePath.getParent(), "clone", "--branch", repository.getBranch(),
                    repository.getRemoteUrl(), clonePath.toString());
            if (clone.exitCode != 0 && !Files.isDirectory(clonePath.resolve(".git"))) {
                throw new DiscoverySourceException(grouping, "git clone failed: " + clone.output);
            }
        }

        String head = currentHead(grouping, clonePath);
        if (repository.getCurrentHead() != null && repository.getCurrentHead().equals(head)) {
            logger.fine("Repository " + repository + " already at " + head);
            return;
        }

        CommandResult fetch = run(grouping, clonePath, "fetch", "origin");
        if (fetch.exitCode != 0) {
            throw new DiscoverySourceException(grouping, "git fetch failed: " + fetch.output);
        }
        String target = repository.getCurrentHead() != null
                ? repository.getCurrentHead()
                : "origin/" + repository.getBranch();
        CommandResult checkout = run(grouping, clonePath, "checkout", "--force", target);
        if (checkout.exitCode != 0) {
            throw new DiscoverySourceException(grouping, "git checkout of " + target + " failed: " + checkout.output);
        }
        logger.info("Repository " + repository + " now at " + currentHead(grouping, clonePath));
    }

    private String currentHead(String grouping, Path clonePath) throws DiscoverySourceException {
        CommandResult revParse = run(grouping, clonePath, "rev-parse", "HEAD");
        if (revParse.exitCode != 0) {
            throw new DiscoverySourceException(grouping, "git rev-parse failed: " + revParse.output);
        }
        return revParse.output.trim();
    }

    private CommandResult run(String grouping, Path workingDirectory, String... args) throws DiscoverySourceException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));

        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("git-" + args[0], ".log");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            process = builder.start();
            if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new DiscoverySourceException(grouping,
                        "git " + args[0] + " timed out after " + commandTimeout.getSeconds() + " seconds");
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return new CommandResult(process.exitValue(), output);
        } catch (IOException e) {
            throw new DiscoverySourceException(grouping, "Failed to run git " + args[0], e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscoverySourceException(grouping, "Interrupted while running git " + args[0], e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            if (outputFile != null) {
                deleteOutput(outputFile);
            }
        }
    }

    private static void deleteOutput(Path outputFile) {
        try {
            Files.deleteIfExists(outputFile);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete git output file " + outputFile, e);
        }
    }

    private static final class CommandResult {
        private final int exitCode;
        private final String output;

        private CommandResult(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }
    }
}
