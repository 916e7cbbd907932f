package com.jobrunner.discovery;

import java.util.List;

/**
 * Source of the configured Git repositories.
 */
@FunctionalInterface
public interface GitRepositoryCatalog {

    List<GitRepositoryRecord> listRepositories();
}
