package com.jobrunner.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ObjectRepository} backed by concurrent maps.
 *
 * <p>Used when the subsystem is embedded without an external inventory, and by the
 * change logger to make recorded {@code ObjectChange}s resolvable by hook receivers.</p>
 */
public class InMemoryObjectRepository implements ObjectRepository {

    private final Map<String, Map<String, DomainObject>> objectsByType = new ConcurrentHashMap<>();
    private final Set<String> registeredTypes = ConcurrentHashMap.newKeySet();

    /**
     * Declare a type as known even before any object of it exists.
     */
    public void registerType(String objectType) {
        registeredTypes.add(objectType);
    }

    public void save(DomainObject object) {
        registeredTypes.add(object.getObjectType());
        objectsByType.computeIfAbsent(object.getObjectType(), k -> new ConcurrentHashMap<>())
                .put(object.getId(), object);
    }

    public boolean delete(String objectType, String id) {
        Map<String, DomainObject> objects = objectsByType.get(objectType);
        return objects != null && objects.remove(id) != null;
    }

    @Override
    public Optional<DomainObject> findById(String objectType, String id) {
        Map<String, DomainObject> objects = objectsByType.get(objectType);
        if (objects == null || id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(objects.get(id));
    }

    @Override
    public List<DomainObject> findAllById(String objectType, Collection<String> ids) {
        List<DomainObject> found = new ArrayList<>();
        Map<String, DomainObject> objects = objectsByType.get(objectType);
        if (objects == null) {
            return found;
        }
        for (String id : ids) {
            DomainObject object = objects.get(id);
            if (object != null) {
                found.add(object);
            }
        }
        return found;
    }

    @Override
    public boolean isKnownType(String objectType) {
        return registeredTypes.contains(objectType);
    }
}
