package com.jobrunner.changes;

import java.util.UUID;

/**
 * Attribution for changes made while the context is active: who made them, through
 * which kind of entry point, and a request id grouping them.
 */
public class ChangeContext {
    private final ChangeContextType type;
    private final String user;
    private final String detail;
    private final String requestId;

    public ChangeContext(ChangeContextType type, String user, String detail, String requestId) {
        this.type = type;
        this.user = user;
        this.detail = detail;
        this.requestId = requestId == null ? UUID.randomUUID().toString() : requestId;
    }

    public static ChangeContext web(String user) {
        return new ChangeContext(ChangeContextType.WEB, user, null, null);
    }

    /**
     * Context for a job run. The job result id is used as the request id so every change
     * the run makes can be traced back to it.
     */
    public static ChangeContext job(String user, String classPath, String jobResultId) {
        return new ChangeContext(ChangeContextType.JOB, user, classPath, jobResultId);
    }

    public static ChangeContext jobHook(String user, String classPath, String jobResultId) {
        return new ChangeContext(ChangeContextType.JOB_HOOK, user, classPath, jobResultId);
    }

    public static ChangeContext orm(String detail) {
        return new ChangeContext(ChangeContextType.ORM, null, detail, null);
    }

    public static ChangeContext unknown() {
        return new ChangeContext(ChangeContextType.UNKNOWN, null, null, null);
    }

    public ChangeContextType getType() {
        return type;
    }

    public String getUser() {
        return user;
    }

    /**
     * Free-form detail, for jobs the class path.
     */
    public String getDetail() {
        return detail;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "ChangeContext{" + type.getValue() + ", user='" + user + "', detail='" + detail + "'}";
    }
}
