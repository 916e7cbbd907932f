package com.jobrunner.changes;

/**
 * Kind of change made to an object.
 */
public enum ChangeAction {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    ChangeAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ChangeAction fromValue(String value) {
        for (ChangeAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown change action: " + value);
    }
}
