package com.jobrunner.changes;

import com.jobrunner.core.DomainObject;

import java.time.Instant;

/**
 * Record of one change to one object. Itself an inventory object, so hook receivers get
 * it through an object variable.
 */
public class ObjectChange implements DomainObject {
    public static final String OBJECT_TYPE = "extras.objectchange";

    private final String id;
    private final Instant time;
    private final String user;
    private final String changedObjectType;
    private final String changedObjectId;
    private final String objectRepr;
    private final ChangeAction action;
    private final ChangeContextType contextType;
    private final String contextDetail;
    private final String requestId;

    public ObjectChange(String id, Instant time, DomainObject changedObject, ChangeAction action, ChangeContext context) {
        this.id = id;
        this.time = time;
        this.user = context.getUser();
        this.changedObjectType = changedObject.getObjectType();
        this.changedObjectId = changedObject.getId();
        this.objectRepr = changedObject.getDisplay();
        this.action = action;
        this.contextType = context.getType();
        this.contextDetail = context.getDetail();
        this.requestId = context.getRequestId();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getObjectType() {
        return OBJECT_TYPE;
    }

    @Override
    public String getDisplay() {
        return objectRepr + " " + action.getValue() + "d by " + (user == null ? "unknown" : user);
    }

    @Override
    public Object getAttribute(String name) {
        return switch (name) {
            case "action" -> action.getValue();
            case "user" -> user;
            case "changed_object_type" -> changedObjectType;
            case "changed_object_id" -> changedObjectId;
            case "change_context" -> contextType.getValue();
            case "request_id" -> requestId;
            default -> DomainObject.super.getAttribute(name);
        };
    }

    public Instant getTime() {
        return time;
    }

    public String getUser() {
        return user;
    }

    public String getChangedObjectType() {
        return changedObjectType;
    }

    public String getChangedObjectId() {
        return changedObjectId;
    }

    public String getObjectRepr() {
        return objectRepr;
    }

    public ChangeAction getAction() {
        return action;
    }

    public ChangeContextType getContextType() {
        return contextType;
    }

    public String getContextDetail() {
        return contextDetail;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "ObjectChange{" + action + " " + changedObjectType + ":" + changedObjectId + ", context=" + contextType + "}";
    }
}
