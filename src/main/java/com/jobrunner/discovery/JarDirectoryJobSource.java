package com.jobrunner.discovery;

import com.jobrunner.core.DiscoverySourceException;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads job modules from the {@code *.jar} files in a directory.
 *
 * <p>Each jar gets its own {@link URLClassLoader} whose parent is the application class
 * loader, so jobs can use this library's types. The jar lists its modules in
 * {@code META-INF/services/com.jobrunner.discovery.JobModule}. A jar that cannot be opened,
 * lists an unknown class or whose module fails to construct is logged and skipped; the
 * other jars still load.</p>
 *
 * <p><b>Class loader reuse:</b> a rescan keeps the loader of a jar whose size and modification
 * time are unchanged. The loader of a jar that changed or disappeared is retired and closed on
 * the following scan, which gives runs started from the old definitions one scan interval to
 * finish loading classes. {@link #close()} releases everything.</p>
 *
 * <p><b>Thread Safety:</b> scans and {@link #close()} are serialized on the instance.</p>
 */
public class JarDirectoryJobSource implements JobSource, Closeable {
    private static final Logger logger = Logger.getLogger(JarDirectoryJobSource.class.getName());

    static final String SERVICE_RESOURCE = "META-INF/services/" + JobModule.class.getName();

    private final String sourceGrouping;
    private final Path directory;
    private final ClassLoader parent;
    private final Map<Path, LoadedJar> loadedJars = new LinkedHashMap<>();
    private final List<URLClassLoader> retired = new ArrayList<>();

    public JarDirectoryJobSource(String sourceGrouping, Path directory) {
        this(sourceGrouping, directory, JarDirectoryJobSource.class.getClassLoader());
    }

    public JarDirectoryJobSource(String sourceGrouping, Path directory, ClassLoader parent) {
        this.sourceGrouping = sourceGrouping;
        this.directory = directory;
        this.parent = parent;
    }

    @Override
    public String getSourceGrouping() {
        return sourceGrouping;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized List<JobModule> loadModules() throws DiscoverySourceException {
        closeRetired();
        List<JobModule> modules = new ArrayList<>();
        Set<Path> present = new HashSet<>();
        if (!Files.isDirectory(directory)) {
            logger.warning("Jobs directory " + directory + " for " + sourceGrouping + " does not exist");
            retireMissing(present);
            return modules;
        }

        try (DirectoryStream<Path> jars = Files.newDirectoryStream(directory, "*.jar")) {
            for (Path jar : jars) {
                present.add(jar);
                try {
                    modules.addAll(loadJar(jar));
                } catch (IOException | ReflectiveOperationException | ClassCastException | LinkageError e) {
                    logger.log(Level.SEVERE, "Failed to load jobs from " + jar + ", skipping it", e);
                }
            }
        } catch (IOException e) {
            throw new DiscoverySourceException(sourceGrouping, "Failed to list jobs directory " + directory, e);
        }
        retireMissing(present);
        return modules;
    }

    private List<JobModule> loadJar(Path jar) throws IOException, ReflectiveOperationException {
        FileTime modified = Files.getLastModifiedTime(jar);
        long size = Files.size(jar);
        LoadedJar cached = loadedJars.get(jar);
        if (cached != null && cached.matches(modified, size)) {
            return instantiateModules(jar, cached.classLoader);
        }

        URLClassLoader classLoader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, parent);
        List<JobModule> modules;
        boolean success = false;
        try {
            modules = instantiateModules(jar, classLoader);
            success = true;
        } finally {
            if (!success) {
                classLoader.close();
            }
        }

        LoadedJar previous = loadedJars.put(jar, new LoadedJar(classLoader, modified, size));
        if (previous != null) {
            logger.info("Jar " + jar + " changed, reloading its job modules");
            retired.add(previous.classLoader);
        }
        return modules;
    }

    private List<JobModule> instantiateModules(Path jar, URLClassLoader classLoader)
            throws IOException, ReflectiveOperationException {
        List<JobModule> modules = new ArrayList<>();
        // findResources only looks in this jar, not in the parent loader
        Enumeration<URL> resources = classLoader.findResources(SERVICE_RESOURCE);
        while (resources.hasMoreElements()) {
            for (String className : readServiceFile(resources.nextElement())) {
                Class<? extends JobModule> moduleClass =
                        Class.forName(className, true, classLoader).asSubclass(JobModule.class);
                modules.add(moduleClass.getDeclaredConstructor().newInstance());
            }
        }
        if (modules.isEmpty()) {
            logger.warning("Jar " + jar + " does not declare any job modules");
        }
        return modules;
    }

    private void retireMissing(Set<Path> present) {
        Iterator<Map.Entry<Path, LoadedJar>> entries = loadedJars.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<Path, LoadedJar> entry = entries.next();
            if (!present.contains(entry.getKey())) {
                logger.info("Jar " + entry.getKey() + " is gone, retiring its class loader");
                retired.add(entry.getValue().classLoader);
                entries.remove();
            }
        }
    }

    private void closeRetired() {
        for (URLClassLoader classLoader : retired) {
            closeQuietly(classLoader);
        }
        retired.clear();
    }

    private void closeQuietly(URLClassLoader classLoader) {
        try {
            classLoader.close();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to close class loader for " + directory, e);
        }
    }

    /**
     * Loaders that are still open: one per loaded jar plus the retired ones awaiting the next scan.
     */
    synchronized int getOpenClassLoaderCount() {
        return loadedJars.size() + retired.size();
    }

    private static List<String> readServiceFile(URL resource) throws IOException {
        List<String> classNames = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.openStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (!line.isEmpty()) {
                    classNames.add(line);
                }
            }
        }
        return classNames;
    }

    @Override
    public synchronized void close() {
        closeRetired();
        for (LoadedJar loaded : loadedJars.values()) {
            closeQuietly(loaded.classLoader);
        }
        loadedJars.clear();
    }

    private static final class LoadedJar {
        private final URLClassLoader classLoader;
        private final FileTime modified;
        private final long size;

        private LoadedJar(URLClassLoader classLoader, FileTime modified, long size) {
            this.classLoader = classLoader;
            this.modified = modified;
            this.size = size;
        }

        private boolean matches(FileTime modified, long size) {
            return this.modified.equals(modified) && this.size == size;
        }
    }
}
