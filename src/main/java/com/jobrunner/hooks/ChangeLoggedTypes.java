package com.jobrunner.hooks;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Object types whose changes are recorded and may trigger job hooks.
 */
public class ChangeLoggedTypes {
    private final Set<String> types = Collections.synchronizedSet(new LinkedHashSet<>());

    public ChangeLoggedTypes() {
    }

    public ChangeLoggedTypes(Collection<String> types) {
        this.types.addAll(types);
    }

    public void register(String objectType) {
        types.add(objectType);
    }

    public boolean contains(String objectType) {
        return objectType != null && types.contains(objectType);
    }

    public Set<String> getTypes() {
        synchronized (types) {
            return Set.copyOf(types);
        }
    }
}
