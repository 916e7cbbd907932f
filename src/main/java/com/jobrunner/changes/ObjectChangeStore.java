package com.jobrunner.changes;

/**
 * Where recorded changes are kept so they can be resolved by id later.
 */
@FunctionalInterface
public interface ObjectChangeStore {

    void save(ObjectChange change);
}
