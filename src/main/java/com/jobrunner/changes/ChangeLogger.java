package com.jobrunner.changes;

import com.jobrunner.core.DomainObject;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records object changes and notifies listeners.
 *
 * <p>A change is attributed to the {@link ChangeContext} active on the calling thread,
 * stored, and then handed to every listener before {@link #recordChange} returns. A failing
 * listener is logged and does not keep the others from being notified.</p>
 */
public class ChangeLogger {
    private static final Logger logger = Logger.getLogger(ChangeLogger.class.getName());

    private final ObjectChangeStore store;
    private final Clock clock;
    private final List<ObjectChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ChangeLogger(ObjectChangeStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void addListener(ObjectChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ObjectChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Record a change made in the current context, or in an unknown context if none is open.
     *
     * @return the recorded change
     */
    public ObjectChange recordChange(DomainObject object, ChangeAction action) {
        ChangeContext context = ChangeLogging.current();
        return recordChange(object, action, context != null ? context : ChangeContext.unknown());
    }

    /**
     * Record a change made in an explicit context.
     *
     * @return the recorded change
     */
    public ObjectChange recordChange(DomainObject object, ChangeAction action, ChangeContext context) {
        ObjectChange change = new ObjectChange(UUID.randomUUID().toString(), clock.instant(), object, action, context);
        store.save(change);
        logger.fine("Recorded " + change);

        for (ObjectChangeListener listener : listeners) {
            try {
                listener.onObjectChange(change);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Change listener failed for " + change, e);
            }
        }
        return change;
    }
}
