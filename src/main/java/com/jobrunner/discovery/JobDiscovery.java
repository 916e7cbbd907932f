package com.jobrunner.discovery;

import com.jobrunner.core.ClassPath;
import com.jobrunner.core.DiscoverySourceException;
import com.jobrunner.core.JobDefinition;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Finds jobs across all sources and keeps the latest {@link JobRegistry} snapshot.
 *
 * <p><b>Sources, in order:</b></p>
 * <ol>
 *   <li>{@code local}: jars in the local jobs root</li>
 *   <li>{@code git.<slug>}: jars in the {@code jobs} directory of each repository clone
 *       under the Git root, synchronized to the recorded head first</li>
 *   <li>{@code plugins}: modules registered by extensions at startup</li>
 * </ol>
 *
 * <p><b>Partial failure:</b> a source that fails to synchronize or scan is logged and
 * skipped; the snapshot still contains every other source.</p>
 *
 * <p><b>Housekeeping:</b> clone directories under the Git root that no configured
 * repository owns are deleted. Entries that are not directories, or not Git clones, are
 * only reported.</p>
 *
 * <p><b>Thread Safety:</b> discovery runs under the instance lock; the snapshot itself is
 * immutable and published through a volatile field, so readers never block.</p>
 */
public class JobDiscovery implements Closeable {
    private static final Logger logger = Logger.getLogger(JobDiscovery.class.getName());

    private static final String GIT_JOBS_DIRECTORY = "jobs";

    private final JarDirectoryJobSource localSource;
    private final ExtensionJobSource extensionSource;
    private final GitRepositoryCatalog gitCatalog;
    private final GitSynchronizer gitSynchronizer;
    private final Path gitRoot;
    private final Map<String, JarDirectoryJobSource> gitSources = new LinkedHashMap<>();
    private volatile JobRegistry registry;

    /**
     * @param jobsRoot local jobs root, or null for none
     * @param extensionSource extension modules registered at startup
     * @param gitCatalog configured Git repositories
     * @param gitSynchronizer brings clones to their recorded head
     * @param gitRoot directory holding one clone per repository slug, or null for none
     */
    public JobDiscovery(Path jobsRoot, ExtensionJobSource extensionSource, GitRepositoryCatalog gitCatalog,
                        GitSynchronizer gitSynchronizer, Path gitRoot) {
        this.localSource = jobsRoot == null ? null : new JarDirectoryJobSource(ClassPath.LOCAL, jobsRoot);
        this.extensionSource = extensionSource;
        this.gitCatalog = gitCatalog;
        this.gitSynchronizer = gitSynchronizer;
        this.gitRoot = gitRoot;
    }

    /**
     * Scan every source and publish the result as the current snapshot.
     *
     * @return the new snapshot
     */
    public synchronized JobRegistry discoverJobs() {
        JobRegistry.Builder builder = JobRegistry.builder();

        if (localSource != null && Files.isDirectory(localSource.getDirectory())) {
            addSource(builder, localSource);
        }

        for (JarDirectoryJobSource gitSource : prepareGitSources()) {
            addSource(builder, gitSource);
        }

        if (extensionSource != null) {
            addSource(builder, extensionSource);
        }

        JobRegistry snapshot = builder.build();
        registry = snapshot;
        logger.info("Discovered " + snapshot.getClassPaths().size() + " jobs");
        return snapshot;
    }

    /**
     * Rescan on demand, e.g. after a repository was synchronized.
     */
    public JobRegistry refresh() {
        return discoverJobs();
    }

    /**
     * The latest snapshot, discovering first if nothing has been scanned yet.
     */
    public JobRegistry current() {
        JobRegistry snapshot = registry;
        return snapshot != null ? snapshot : discoverJobs();
    }

    /**
     * Look up a job by class path string.
     *
     * @return the definition, or null if the class path is malformed or unknown
     */
    public JobDefinition getJob(String classPath) {
        Optional<ClassPath> parsed = ClassPath.tryParse(classPath);
        if (parsed.isEmpty()) {
            logger.severe("Invalid class_path value \"" + classPath + "\"");
            return null;
        }
        return current().getJob(parsed.get());
    }

    /**
     * Class paths in the current snapshot, for existence checks that need no definition.
     */
    public Set<String> listClassPaths() {
        return current().getClassPaths();
    }

    private void addSource(JobRegistry.Builder builder, JobSource source) {
        try {
            for (JobModule module : source.loadModules()) {
                builder.addModule(source.getSourceGrouping(), module);
            }
        } catch (DiscoverySourceException e) {
            logger.log(Level.SEVERE, "Skipping job source " + e.getSourceGrouping() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Skipping job source " + source.getSourceGrouping() + " after unexpected error", e);
        }
    }

    private List<JarDirectoryJobSource> prepareGitSources() {
        List<JarDirectoryJobSource> ready = new ArrayList<>();
        if (gitRoot == null || gitCatalog == null || !Files.isDirectory(gitRoot)) {
            return ready;
        }

        Set<String> configuredSlugs = new HashSet<>();
        for (GitRepositoryRecord repository : gitCatalog.listRepositories()) {
            configuredSlugs.add(repository.getSlug());
            if (!repository.providesJobs()) {
                continue;
            }
            Path clonePath = gitRoot.resolve(repository.getSlug());
            try {
                gitSynchronizer.ensureSynchronized(repository, clonePath);
            } catch (DiscoverySourceException e) {
                logger.log(Level.SEVERE, "Error during local clone of Git repository " + repository + ": " + e.getMessage(), e);
                continue;
            }

            Path jobsPath = clonePath.resolve(GIT_JOBS_DIRECTORY);
            if (!Files.isDirectory(jobsPath)) {
                logger.warning("Git repository " + repository + " is configured to provide jobs, but none are found!");
                continue;
            }
            ready.add(gitSources.computeIfAbsent(repository.getSlug(),
                    slug -> new JarDirectoryJobSource(ClassPath.gitSourceGrouping(slug), jobsPath)));
        }

        deleteOrphanedClones(configuredSlugs);
        return ready;
    }

    private void deleteOrphanedClones(Set<String> configuredSlugs) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(gitRoot)) {
            for (Path entry : entries) {
                String slug = entry.getFileName().toString();
                if (!Files.isDirectory(entry)) {
                    logger.warning("Found non-directory " + slug + " in " + gitRoot
                            + ". Only Git repositories should exist here.");
                } else if (!Files.isDirectory(entry.resolve(".git"))) {
                    logger.warning("Directory " + slug + " in " + gitRoot + " does not appear to be a Git repository.");
                } else if (!configuredSlugs.contains(slug)) {
                    logger.warning("Deleting unmanaged (leftover?) repository at " + entry);
                    JarDirectoryJobSource stale = gitSources.remove(slug);
                    if (stale != null) {
                        stale.close();
                    }
                    deleteRecursively(entry);
                }
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to inspect Git root " + gitRoot, e);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> ordered = new ArrayList<>();
            paths.sorted(Comparator.reverseOrder()).forEach(ordered::add);
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (localSource != null) {
            localSource.close();
        }
        gitSources.values().forEach(JarDirectoryJobSource::close);
        gitSources.clear();
    }
}
