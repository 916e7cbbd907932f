package com.jobrunner.discovery;

import com.jobrunner.core.DiscoverySourceException;

import java.util.List;

/**
 * One place jobs are loaded from, contributing all its modules under one source grouping.
 */
public interface JobSource {

    /**
     * {@code local}, {@code plugins} or {@code git.<slug>}.
     */
    String getSourceGrouping();

    /**
     * Load the modules currently available from this source.
     *
     * @throws DiscoverySourceException if the source as a whole cannot be read
     */
    List<JobModule> loadModules() throws DiscoverySourceException;
}
