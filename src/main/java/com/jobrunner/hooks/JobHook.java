package com.jobrunner.hooks;

import com.jobrunner.changes.ChangeAction;

import java.util.ArrayList;
import java.util.List;

/**
 * Registration that runs a hook receiver job when objects of the given types change.
 * Stored in {@code job_hooks}.
 */
public class JobHook {
    private String id;
    private String name;
    private String classPath;
    private List<String> contentTypes = new ArrayList<>();
    private boolean typeCreate;
    private boolean typeUpdate;
    private boolean typeDelete;
    private boolean enabled = true;

    /**
     * Whether this hook fires for the given action on the given object type.
     */
    public boolean matches(String objectType, ChangeAction action) {
        if (!enabled || !contentTypes.contains(objectType)) {
            return false;
        }
        return switch (action) {
            case CREATE -> typeCreate;
            case UPDATE -> typeUpdate;
            case DELETE -> typeDelete;
        };
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getClassPath() { return classPath; }
    public void setClassPath(String classPath) { this.classPath = classPath; }

    public List<String> getContentTypes() { return contentTypes; }
    public void setContentTypes(List<String> contentTypes) { this.contentTypes = new ArrayList<>(contentTypes); }

    public boolean isTypeCreate() { return typeCreate; }
    public void setTypeCreate(boolean typeCreate) { this.typeCreate = typeCreate; }

    public boolean isTypeUpdate() { return typeUpdate; }
    public void setTypeUpdate(boolean typeUpdate) { this.typeUpdate = typeUpdate; }

    public boolean isTypeDelete() { return typeDelete; }
    public void setTypeDelete(boolean typeDelete) { this.typeDelete = typeDelete; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Override
    public String toString() {
        return "JobHook{name='" + name + "', classPath='" + classPath + "', contentTypes=" + contentTypes + "}";
    }
}
