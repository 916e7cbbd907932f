package com.jobrunner.discovery;

import com.jobrunner.core.JobDefinition;

import java.util.List;

/**
 * A named group of job definitions shipped together.
 *
 * <p>Jar-based sources find modules through a
 * {@code META-INF/services/com.jobrunner.discovery.JobModule} entry listing implementation
 * class names, one per line. Implementations need a public no-argument constructor.</p>
 */
public interface JobModule {

    /**
     * Dotted module name, used as the middle segment of each job's class path.
     */
    String getModuleName();

    /**
     * Human readable name; jobs without their own grouping are grouped under it.
     */
    default String getDisplayName() {
        return getModuleName();
    }

    /**
     * Definitions in this module, unbound; discovery binds them to their class paths.
     */
    List<JobDefinition> getJobDefinitions();
}
