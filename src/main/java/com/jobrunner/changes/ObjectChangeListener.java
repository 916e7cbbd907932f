package com.jobrunner.changes;

/**
 * Notified synchronously for every recorded {@link ObjectChange}.
 */
public interface ObjectChangeListener {

    void onObjectChange(ObjectChange change);
}
