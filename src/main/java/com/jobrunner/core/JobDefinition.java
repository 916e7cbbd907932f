package com.jobrunner.core;

import com.jobrunner.vars.FileVar;
import com.jobrunner.vars.JobVariable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything known about a job apart from its body: metadata, declared variables and
 * execution policy.
 *
 * <p>Definitions are immutable and shared by every execution of the job. A definition may
 * name a parent; it then inherits the parent's variables, kind and body factory, and any
 * policy attribute it leaves unset.</p>
 *
 * <p><b>Variable merge:</b> the chain is walked from the root parent down to this
 * definition. A variable keeps the position where its name first appears, so base
 * variables come before subclass variables, and a name declared again further down the
 * chain replaces the declaration without adding a second entry.</p>
 *
 * <p><b>Class path:</b> a definition built by a module has no class path until discovery
 * binds it to a source with {@link #bind(String, String)}.</p>
 *
 * <pre>{@code
 * JobDefinition definition = JobDefinition.builder("BackupConfigs")
 *     .name("Backup device configs")
 *     .variable("device", new ObjectVar("dcim.device"))
 *     .variable("dry_run", new BooleanVar())
 *     .hasSensitiveVariables(false)
 *     .factory(BackupConfigs::new)
 *     .build();
 * }</pre>
 */
public final class JobDefinition {

    private final String className;
    private final String name;
    private final String grouping;
    private final String description;
    private final boolean hidden;
    private final List<String> fieldOrder;
    private final Boolean approvalRequired;
    private final Boolean hasSensitiveVariables;
    private final Boolean readOnly;
    private final Duration softTimeLimit;
    private final Duration timeLimit;
    private final List<String> taskQueues;
    private final JobKind kind;
    private final Map<String, JobVariable<?, ?>> ownVariables;
    private final JobDefinition parent;
    private final Supplier<? extends Job> factory;
    private final ClassPath classPath;

    private JobDefinition(Builder builder) {
        this.className = builder.className;
        this.name = builder.name;
        this.grouping = builder.grouping;
        this.description = builder.description;
        this.hidden = builder.hidden;
        this.fieldOrder = List.copyOf(builder.fieldOrder);
        this.approvalRequired = builder.approvalRequired;
        this.hasSensitiveVariables = builder.hasSensitiveVariables;
        this.readOnly = builder.readOnly;
        this.softTimeLimit = builder.softTimeLimit;
        this.timeLimit = builder.timeLimit;
        this.taskQueues = builder.taskQueues == null ? null : List.copyOf(builder.taskQueues);
        this.kind = builder.kind;
        this.ownVariables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.parent = builder.parent;
        this.factory = builder.factory;
        this.classPath = null;
    }

    private JobDefinition(JobDefinition source, ClassPath classPath) {
        this.className = source.className;
        this.name = source.name;
        this.grouping = source.grouping;
        this.description = source.description;
        this.hidden = source.hidden;
        this.fieldOrder = source.fieldOrder;
        this.approvalRequired = source.approvalRequired;
        this.hasSensitiveVariables = source.hasSensitiveVariables;
        this.readOnly = source.readOnly;
        this.softTimeLimit = source.softTimeLimit;
        this.timeLimit = source.timeLimit;
        this.taskQueues = source.taskQueues;
        this.kind = source.kind;
        this.ownVariables = source.ownVariables;
        this.parent = source.parent;
        this.factory = source.factory;
        this.classPath = classPath;
    }

    public static Builder builder(String className) {
        return new Builder(className);
    }

    /**
     * Copy of this definition addressed as {@code sourceGrouping/moduleName/className}.
     */
    public JobDefinition bind(String sourceGrouping, String moduleName) {
        return new JobDefinition(this, new ClassPath(sourceGrouping, moduleName, className));
    }

    /**
     * Create a fresh job body for one execution.
     *
     * @throws IllegalStateException if neither this definition nor a parent provides a factory
     */
    public Job newInstance() {
        Supplier<? extends Job> supplier = resolveFactory();
        if (supplier == null) {
            throw new IllegalStateException("Job " + className + " has no implementation");
        }
        return supplier.get();
    }

    /**
     * Whether this definition can be run, i.e. it or a parent provides a body.
     */
    public boolean isRunnable() {
        return resolveFactory() != null;
    }

    private Supplier<? extends Job> resolveFactory() {
        for (JobDefinition d = this; d != null; d = d.parent) {
            if (d.factory != null) {
                return d.factory;
            }
        }
        return null;
    }

    /**
     * All variables of this definition and its parents, in merge order.
     */
    public Map<String, JobVariable<?, ?>> getVariables() {
        Deque<JobDefinition> chain = new ArrayDeque<>();
        for (JobDefinition d = this; d != null; d = d.parent) {
            chain.push(d);
        }
        Map<String, JobVariable<?, ?>> merged = new LinkedHashMap<>();
        for (JobDefinition d : chain) {
            // put() on an existing key keeps its position
            merged.putAll(d.ownVariables);
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * All variables, with the names in the field order first and the rest after them.
     */
    public Map<String, JobVariable<?, ?>> getVariablesInFieldOrder() {
        Map<String, JobVariable<?, ?>> variables = getVariables();
        if (fieldOrder.isEmpty()) {
            return variables;
        }
        Map<String, JobVariable<?, ?>> ordered = new LinkedHashMap<>();
        for (String field : fieldOrder) {
            if (variables.containsKey(field)) {
                ordered.put(field, variables.get(field));
            }
        }
        ordered.putAll(variables);
        return Collections.unmodifiableMap(ordered);
    }

    /**
     * Names of the variables that hold uploaded files.
     */
    public List<String> getFileVariableNames() {
        List<String> names = new ArrayList<>();
        getVariables().forEach((variableName, variable) -> {
            if (variable instanceof FileVar) {
                names.add(variableName);
            }
        });
        return names;
    }

    public Map<String, JobVariable<?, ?>> getOwnVariables() {
        return ownVariables;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Bound class path, or null if the definition has not been through discovery.
     */
    public ClassPath getClassPath() {
        return classPath;
    }

    public String getName() {
        return name != null ? name : className;
    }

    /**
     * Display category; null means the module's display name.
     */
    public String getGrouping() {
        return grouping;
    }

    public String getDescription() {
        return description == null ? "" : description;
    }

    public boolean isHidden() {
        return hidden;
    }

    public List<String> getFieldOrder() {
        return fieldOrder;
    }

    public boolean isApprovalRequired() {
        Boolean value = inherited(d -> d.approvalRequired);
        return value != null && value;
    }

    public boolean hasSensitiveVariables() {
        Boolean value = inherited(d -> d.hasSensitiveVariables);
        return value == null || value;
    }

    public boolean isReadOnly() {
        Boolean value = inherited(d -> d.readOnly);
        return value != null && value;
    }

    /**
     * Soft time limit; {@link Duration#ZERO} means the configured default.
     */
    public Duration getSoftTimeLimit() {
        Duration value = inherited(d -> d.softTimeLimit);
        return value == null ? Duration.ZERO : value;
    }

    /**
     * Hard time limit; {@link Duration#ZERO} means the configured default.
     */
    public Duration getTimeLimit() {
        Duration value = inherited(d -> d.timeLimit);
        return value == null ? Duration.ZERO : value;
    }

    /**
     * Queues this job may be sent to; empty means only the default queue.
     */
    public List<String> getTaskQueues() {
        List<String> value = inherited(d -> d.taskQueues);
        return value == null ? List.of() : value;
    }

    public JobKind getKind() {
        JobKind value = inherited(d -> d.kind);
        return value == null ? JobKind.STANDARD : value;
    }

    public JobDefinition getParent() {
        return parent;
    }

    private <V> V inherited(Function<JobDefinition, V> attribute) {
        for (JobDefinition d = this; d != null; d = d.parent) {
            V value = attribute.apply(d);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "JobDefinition{" + (classPath != null ? classPath : className) + "}";
    }

    /**
     * Builder for {@link JobDefinition}.
     */
    public static final class Builder {
        private final String className;
        private String name;
        private String grouping;
        private String description;
        private boolean hidden;
        private List<String> fieldOrder = List.of();
        private Boolean approvalRequired;
        private Boolean hasSensitiveVariables;
        private Boolean readOnly;
        private Duration softTimeLimit;
        private Duration timeLimit;
        private List<String> taskQueues;
        private JobKind kind;
        private final Map<String, JobVariable<?, ?>> variables = new LinkedHashMap<>();
        private JobDefinition parent;
        private Supplier<? extends Job> factory;

        private Builder(String className) {
            if (className == null || className.isEmpty() || className.contains("/")) {
                throw new IllegalArgumentException("Invalid class name: " + className);
            }
            this.className = className;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder grouping(String grouping) {
            this.grouping = grouping;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public Builder fieldOrder(List<String> fieldOrder) {
            this.fieldOrder = Objects.requireNonNull(fieldOrder);
            return this;
        }

        public Builder approvalRequired(boolean approvalRequired) {
            this.approvalRequired = approvalRequired;
            return this;
        }

        public Builder hasSensitiveVariables(boolean hasSensitiveVariables) {
            this.hasSensitiveVariables = hasSensitiveVariables;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder softTimeLimit(Duration softTimeLimit) {
            this.softTimeLimit = softTimeLimit;
            return this;
        }

        public Builder timeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder taskQueues(List<String> taskQueues) {
            this.taskQueues = taskQueues;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        /**
         * Declare a variable. Declaration order is kept.
         */
        public Builder variable(String variableName, JobVariable<?, ?> variable) {
            variables.put(Objects.requireNonNull(variableName), Objects.requireNonNull(variable));
            return this;
        }

        public Builder parent(JobDefinition parent) {
            this.parent = parent;
            return this;
        }

        public Builder factory(Supplier<? extends Job> factory) {
            this.factory = factory;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}
