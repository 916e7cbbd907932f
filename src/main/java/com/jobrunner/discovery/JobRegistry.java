package com.jobrunner.discovery;

import com.jobrunner.core.ClassPath;
import com.jobrunner.core.JobDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Immutable snapshot of the discovered jobs:
 * source grouping, then module name, then class name.
 *
 * <p>Every definition in a registry is bound to the class path it is filed under.</p>
 */
public final class JobRegistry {

    /**
     * The jobs of one module and the name it is displayed under.
     */
    public static final class ModuleEntry {
        private final String displayName;
        private final Map<String, JobDefinition> jobs;

        private ModuleEntry(String displayName, Map<String, JobDefinition> jobs) {
            this.displayName = displayName;
            this.jobs = Collections.unmodifiableMap(jobs);
        }

        public String getDisplayName() {
            return displayName;
        }

        public Map<String, JobDefinition> getJobs() {
            return jobs;
        }
    }

    private static final JobRegistry EMPTY = new JobRegistry(new LinkedHashMap<>());

    private final Map<String, Map<String, ModuleEntry>> sources;
    private final Set<String> classPaths;

    private JobRegistry(Map<String, Map<String, ModuleEntry>> sources) {
        this.sources = Collections.unmodifiableMap(sources);
        Set<String> paths = new LinkedHashSet<>();
        for (JobDefinition definition : getAllJobs()) {
            paths.add(definition.getClassPath().toString());
        }
        this.classPaths = Collections.unmodifiableSet(paths);
    }

    public static JobRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the definition, or null if not in this snapshot
     */
    public JobDefinition getJob(ClassPath classPath) {
        Map<String, ModuleEntry> modules = sources.get(classPath.getSourceGrouping());
        if (modules == null) {
            return null;
        }
        ModuleEntry module = modules.get(classPath.getModuleName());
        if (module == null) {
            return null;
        }
        return module.getJobs().get(classPath.getClassName());
    }

    public boolean contains(String classPath) {
        return classPaths.contains(classPath);
    }

    public Set<String> getClassPaths() {
        return classPaths;
    }

    public Map<String, Map<String, ModuleEntry>> getSources() {
        return sources;
    }

    public List<JobDefinition> getAllJobs() {
        List<JobDefinition> jobs = new ArrayList<>();
        for (Map<String, ModuleEntry> modules : sources.values()) {
            for (ModuleEntry module : modules.values()) {
                jobs.addAll(module.getJobs().values());
            }
        }
        return jobs;
    }

    /**
     * Display name of the module a class path belongs to, or null if unknown.
     */
    public String getModuleDisplayName(ClassPath classPath) {
        Map<String, ModuleEntry> modules = sources.get(classPath.getSourceGrouping());
        ModuleEntry module = modules == null ? null : modules.get(classPath.getModuleName());
        return module == null ? null : module.getDisplayName();
    }

    /**
     * Collects modules per source and binds their definitions.
     */
    public static final class Builder {
        private static final Logger logger = Logger.getLogger(JobRegistry.class.getName());

        private final Map<String, Map<String, Map<String, JobDefinition>>> jobs = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> displayNames = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder addModule(String sourceGrouping, JobModule module) {
            String moduleName = module.getModuleName();
            Map<String, JobDefinition> moduleJobs = jobs
                    .computeIfAbsent(sourceGrouping, k -> new LinkedHashMap<>())
                    .computeIfAbsent(moduleName, k -> new LinkedHashMap<>());
            displayNames.computeIfAbsent(sourceGrouping, k -> new LinkedHashMap<>())
                    .putIfAbsent(moduleName, module.getDisplayName());

            for (JobDefinition definition : module.getJobDefinitions()) {
                if (!definition.isRunnable()) {
                    logger.warning("Skipping " + definition.getClassName() + " in " + moduleName + ": no implementation");
                    continue;
                }
                JobDefinition bound = definition.bind(sourceGrouping, moduleName);
                if (moduleJobs.put(bound.getClassName(), bound) != null) {
                    logger.warning("Duplicate job " + bound.getClassPath() + ", keeping the last one loaded");
                }
            }
            return this;
        }

        public JobRegistry build() {
            Map<String, Map<String, ModuleEntry>> sources = new LinkedHashMap<>();
            jobs.forEach((sourceGrouping, modules) -> {
                Map<String, ModuleEntry> entries = new LinkedHashMap<>();
                modules.forEach((moduleName, moduleJobs) -> entries.put(moduleName,
                        new ModuleEntry(displayNames.get(sourceGrouping).get(moduleName), new LinkedHashMap<>(moduleJobs))));
                sources.put(sourceGrouping, Collections.unmodifiableMap(entries));
            });
            return new JobRegistry(sources);
        }
    }
}
