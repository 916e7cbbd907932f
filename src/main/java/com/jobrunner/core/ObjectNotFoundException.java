package com.jobrunner.core;

import java.util.List;

/**
 * Exception thrown when a referenced domain object, stored file or record no longer exists.
 *
 * <p>During execution this is not recovered locally: the executor turns it into a
 * {@link JobStatus#FAILURE} result. Button dispatch surfaces it to the caller instead.</p>
 */
public class ObjectNotFoundException extends Exception {

    private final String objectType;
    private final List<String> missingIds;

    public ObjectNotFoundException(String message) {
        super(message);
        this.objectType = null;
        this.missingIds = List.of();
    }

    public ObjectNotFoundException(String message, String objectType, List<String> missingIds) {
        super(message);
        this.objectType = objectType;
        this.missingIds = List.copyOf(missingIds);
    }

    /**
     * Get the type of the missing objects, if known.
     *
     * @return the object type, or null
     */
    public String getObjectType() {
        return objectType;
    }

    public List<String> getMissingIds() {
        return missingIds;
    }
}
