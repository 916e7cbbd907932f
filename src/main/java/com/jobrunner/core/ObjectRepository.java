package com.jobrunner.core;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the live inventory.
 *
 * <p>Object variables resolve primary keys through this interface when job input is
 * validated and again when it is deserialized on the worker, so that a job always sees
 * current data even if it sat on the queue for a while.</p>
 */
public interface ObjectRepository {

    /**
     * Look up a single object.
     *
     * @param objectType type name, e.g. {@code dcim.device}
     * @param id primary key
     * @return the object, or empty if it does not exist
     */
    Optional<DomainObject> findById(String objectType, String id);

    /**
     * Look up several objects of one type. Ids that do not exist are simply absent
     * from the result.
     */
    List<DomainObject> findAllById(String objectType, Collection<String> ids);

    /**
     * Whether objects of this type can be looked up at all.
     */
    boolean isKnownType(String objectType);
}
