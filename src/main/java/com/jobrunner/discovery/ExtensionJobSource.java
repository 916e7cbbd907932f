package com.jobrunner.discovery;

import com.jobrunner.core.ClassPath;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Jobs contributed by extensions already on the application classpath, under the
 * {@code plugins} source grouping.
 *
 * <p>Modules are registered once at startup, explicitly or through {@link ServiceLoader}.</p>
 */
public class ExtensionJobSource implements JobSource {
    private static final Logger logger = Logger.getLogger(ExtensionJobSource.class.getName());

    private final List<JobModule> modules = new CopyOnWriteArrayList<>();

    public void register(JobModule module) {
        modules.add(module);
        logger.info("Registered extension job module " + module.getModuleName());
    }

    /**
     * Register every {@link JobModule} provider visible to the given class loader.
     *
     * @return the number of modules registered
     */
    public int registerServiceProviders(ClassLoader classLoader) {
        int count = 0;
        for (JobModule module : ServiceLoader.load(JobModule.class, classLoader)) {
            register(module);
            count++;
        }
        return count;
    }

    @Override
    public String getSourceGrouping() {
        return ClassPath.PLUGINS;
    }

    @Override
    public List<JobModule> loadModules() {
        return new ArrayList<>(modules);
    }
}
