package com.jobrunner.vars;

import com.jobrunner.core.DomainObject;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single inventory object. Stored as its id and looked up again when the job runs,
 * so the job sees current data.
 */
public class ObjectVar extends AbstractObjectVar<DomainObject, ObjectVar> {

    public ObjectVar(String modelType) {
        super(DomainObject.class, modelType);
    }

    @Override
    protected ObjectVar self() {
        return this;
    }

    @Override
    protected DomainObject convert(Object raw, VariableServices services) throws ValidationException {
        checkKnownType(services);
        Optional<DomainObject> object = services.getObjectRepository().findById(getModelType(), idOf(raw));
        if (object.isEmpty() || !matchesQuery(object.get())) {
            throw invalid("Select a valid choice. That choice is not one of the available choices.");
        }
        return object.get();
    }

    @Override
    public Object serialize(DomainObject value, VariableServices services) {
        return value == null ? null : value.getId();
    }

    /**
     * Resolve the stored id, or a map of attribute lookups, against the live inventory.
     *
     * @throws ObjectNotFoundException if the object no longer exists
     */
    @Override
    public DomainObject deserialize(Object stored, VariableServices services)
            throws ObjectNotFoundException, ValidationException {
        if (stored == null) {
            return null;
        }
        if (stored instanceof Map) {
            Map<?, ?> lookup = (Map<?, ?>) stored;
            Object id = lookup.containsKey("id") ? lookup.get("id") : lookup.get("pk");
            if (id == null) {
                throw invalid("Object lookup must name an id.");
            }
            stored = id;
        }
        String id = idOf(stored);
        Optional<DomainObject> object = services.getObjectRepository().findById(getModelType(), id);
        if (object.isEmpty()) {
            throw new ObjectNotFoundException(getModelType() + " matching query does not exist.",
                    getModelType(), List.of(id));
        }
        return object.get();
    }
}
