package com.jobrunner.core;

/**
 * An inventory object that jobs may reference through object variables or log entries.
 *
 * <p>The inventory itself lives outside this subsystem; all that is needed here is a
 * stable primary key, the object's type name (for example {@code dcim.device}) and
 * something to show a human.</p>
 */
public interface DomainObject {

    String getId();

    String getObjectType();

    default String getDisplay() {
        return getId();
    }

    /**
     * Read a named attribute, used for display fields and query filters of object variables.
     *
     * @return the attribute value, or null if the object has no such attribute
     */
    default Object getAttribute(String name) {
        return switch (name) {
            case "id", "pk" -> getId();
            case "display" -> getDisplay();
            default -> null;
        };
    }
}
