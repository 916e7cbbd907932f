package com.jobrunner.discovery;

import com.jobrunner.core.DiscoverySourceException;

import java.nio.file.Path;

/**
 * Brings a local clone to the commit recorded for its repository.
 *
 * <p>Several worker processes may share the clone directory, so implementations must be
 * idempotent: finding the clone already at the recorded commit is success, not an error.</p>
 */
public interface GitSynchronizer {

    /**
     * @param repository the repository record
     * @param clonePath where the clone lives or should be created
     * @throws DiscoverySourceException if the clone cannot be brought to the recorded commit
     */
    void ensureSynchronized(GitRepositoryRecord repository, Path clonePath) throws DiscoverySourceException;
}
