package com.jobrunner.vars;

import com.jobrunner.core.DomainObject;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One or more inventory objects. Stored as a list of ids.
 */
public class MultiObjectVar extends AbstractObjectVar<List<DomainObject>, MultiObjectVar> {

    public MultiObjectVar(String modelType) {
        super(modelType);
    }

    @Override
    protected MultiObjectVar self() {
        return this;
    }

    @Override
    protected List<DomainObject> castValue(Object value) {
        List<DomainObject> objects = new ArrayList<>();
        for (Object item : (Collection<?>) value) {
            objects.add((DomainObject) item);
        }
        return objects;
    }

    @Override
    protected List<DomainObject> convert(Object raw, VariableServices services) throws ValidationException {
        checkKnownType(services);
        Set<String> ids = idsOf(raw);
        List<DomainObject> objects = services.getObjectRepository().findAllById(getModelType(), ids);
        Set<String> found = new LinkedHashSet<>();
        for (DomainObject object : objects) {
            if (matchesQuery(object)) {
                found.add(object.getId());
            }
        }
        for (String id : ids) {
            if (!found.contains(id)) {
                throw invalid("Select a valid choice. " + id + " is not one of the available choices.");
            }
        }
        return ordered(ids, objects);
    }

    @Override
    public Object serialize(List<DomainObject> value, VariableServices services) {
        if (value == null) {
            return null;
        }
        List<String> ids = new ArrayList<>();
        for (DomainObject object : value) {
            ids.add(object.getId());
        }
        return ids;
    }

    /**
     * Resolve the stored ids against the live inventory.
     *
     * @throws ObjectNotFoundException naming every id that no longer exists
     */
    @Override
    public List<DomainObject> deserialize(Object stored, VariableServices services)
            throws ObjectNotFoundException, ValidationException {
        if (stored == null) {
            return null;
        }
        Set<String> ids = idsOf(stored);
        List<DomainObject> objects = services.getObjectRepository().findAllById(getModelType(), ids);
        if (objects.size() < ids.size()) {
            Set<String> missing = new LinkedHashSet<>(ids);
            for (DomainObject object : objects) {
                missing.remove(object.getId());
            }
            throw new ObjectNotFoundException("Failed to find requested objects: [" + String.join(", ", missing) + "]",
                    getModelType(), new ArrayList<>(missing));
        }
        return ordered(ids, objects);
    }

    private static Set<String> idsOf(Object raw) throws ValidationException {
        if (!(raw instanceof Collection)) {
            throw invalid("Enter a list of values.");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Object item : (Collection<?>) raw) {
            ids.add(idOf(item));
        }
        return ids;
    }

    private static List<DomainObject> ordered(Set<String> ids, List<DomainObject> objects) {
        List<DomainObject> result = new ArrayList<>();
        for (String id : ids) {
            for (DomainObject object : objects) {
                if (object.getId().equals(id)) {
                    result.add(object);
                    break;
                }
            }
        }
        return result;
    }
}
