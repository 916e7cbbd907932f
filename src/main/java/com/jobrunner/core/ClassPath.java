package com.jobrunner.core;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The three-segment address of a job: {@code <source_grouping>/<module_name>/<ClassName>}.
 *
 * <p>The source grouping is {@code local}, {@code plugins} or {@code git.<repository-slug>}.
 * The module name is a dotted path and the class name is the job's simple name, so
 * {@code git.config-backups/backups.juniper/BackupJunos} is a well formed class path.</p>
 */
public final class ClassPath {

    public static final String LOCAL = "local";
    public static final String PLUGINS = "plugins";
    public static final String GIT_PREFIX = "git.";

    private static final Pattern SLUG = Pattern.compile("[-a-zA-Z0-9_]+");

    private final String sourceGrouping;
    private final String moduleName;
    private final String className;

    public ClassPath(String sourceGrouping, String moduleName, String className) {
        if (!isValidSourceGrouping(sourceGrouping)) {
            throw new IllegalArgumentException("Invalid source grouping: " + sourceGrouping);
        }
        if (moduleName == null || moduleName.isEmpty()) {
            throw new IllegalArgumentException("Module name must not be empty");
        }
        if (className == null || className.isEmpty() || className.contains("/")) {
            throw new IllegalArgumentException("Invalid class name: " + className);
        }
        this.sourceGrouping = sourceGrouping;
        this.moduleName = moduleName;
        this.className = className;
    }

    /**
     * Parse a class path string.
     *
     * @throws IllegalArgumentException if the string is not a well formed class path
     */
    public static ClassPath parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Class path must not be null");
        }
        String[] parts = value.split("/", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Class path must have three '/'-separated parts: " + value);
        }
        return new ClassPath(parts[0], parts[1], parts[2]);
    }

    /**
     * Parse a class path string, returning empty instead of throwing.
     */
    public static Optional<ClassPath> tryParse(String value) {
        try {
            return Optional.of(parse(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isValidSourceGrouping(String sourceGrouping) {
        if (sourceGrouping == null) {
            return false;
        }
        if (LOCAL.equals(sourceGrouping) || PLUGINS.equals(sourceGrouping)) {
            return true;
        }
        return sourceGrouping.startsWith(GIT_PREFIX)
                && SLUG.matcher(sourceGrouping.substring(GIT_PREFIX.length())).matches();
    }

    public static String gitSourceGrouping(String repositorySlug) {
        return GIT_PREFIX + repositorySlug;
    }

    public String getSourceGrouping() {
        return sourceGrouping;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Whether this job was loaded from a Git repository clone.
     */
    public boolean isFromGit() {
        return sourceGrouping.startsWith(GIT_PREFIX);
    }

    /**
     * The class path joined with dots; used as the name of the job's process logger.
     */
    public String toDotted() {
        return sourceGrouping + "." + moduleName + "." + className;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClassPath)) {
            return false;
        }
        ClassPath other = (ClassPath) o;
        return sourceGrouping.equals(other.sourceGrouping)
                && moduleName.equals(other.moduleName)
                && className.equals(other.className);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceGrouping, moduleName, className);
    }

    @Override
    public String toString() {
        return sourceGrouping + "/" + moduleName + "/" + className;
    }
}
