package com.jobrunner.hooks;

import java.util.ArrayList;
import java.util.List;

/**
 * A button shown on objects of the given types that runs a button receiver job.
 * Stored in {@code job_buttons}.
 */
public class JobButton {
    private String id;
    private String name;
    private String classPath;
    private List<String> contentTypes = new ArrayList<>();
    private String text;
    private int weight = 100;
    private String groupName;
    private String buttonClass = "default";
    private boolean confirmation = true;

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getClassPath() { return classPath; }
    public void setClassPath(String classPath) { this.classPath = classPath; }

    public List<String> getContentTypes() { return contentTypes; }
    public void setContentTypes(List<String> contentTypes) { this.contentTypes = new ArrayList<>(contentTypes); }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public int getWeight() { return weight; }
    public void setWeight(int weight) { this.weight = weight; }

    public String getGroupName() { return groupName; }
    public void setGroupName(String groupName) { this.groupName = groupName; }

    public String getButtonClass() { return buttonClass; }
    public void setButtonClass(String buttonClass) { this.buttonClass = buttonClass; }

    public boolean isConfirmation() { return confirmation; }
    public void setConfirmation(boolean confirmation) { this.confirmation = confirmation; }

    @Override
    public String toString() {
        return "JobButton{name='" + name + "', classPath='" + classPath + "'}";
    }
}
