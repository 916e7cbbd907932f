package com.jobrunner.core;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Value returned by {@link Job#run(JobContext, java.util.Map)}.
 *
 * <p>Exactly one of three shapes:</p>
 * <ul>
 *   <li>{@link Kind#SUCCESS} carrying the job's return value (may be null)</li>
 *   <li>{@link Kind#FAILURE} carrying the message the job failed with</li>
 *   <li>{@link Kind#ERROR} carrying the stack trace of an unexpected problem</li>
 * </ul>
 *
 * <p>Failures created by {@link JobContext#logFailure(String)} have already been
 * written to the job log; failures created directly through {@link #failure(String)}
 * are logged by the executor when it records the terminal status.</p>
 */
public final class ExecutionOutcome {

    public enum Kind {
        SUCCESS,
        FAILURE,
        ERROR
    }

    private final Kind kind;
    private final Object value;
    private final String message;
    private final String trace;
    private final boolean logged;

    private ExecutionOutcome(Kind kind, Object value, String message, String trace, boolean logged) {
        this.kind = kind;
        this.value = value;
        this.message = message;
        this.trace = trace;
        this.logged = logged;
    }

    public static ExecutionOutcome success() {
        return new ExecutionOutcome(Kind.SUCCESS, null, null, null, false);
    }

    public static ExecutionOutcome success(Object value) {
        return new ExecutionOutcome(Kind.SUCCESS, value, null, null, false);
    }

    public static ExecutionOutcome failure(String message) {
        return new ExecutionOutcome(Kind.FAILURE, null, message, null, false);
    }

    static ExecutionOutcome loggedFailure(String message) {
        return new ExecutionOutcome(Kind.FAILURE, null, message, null, true);
    }

    public static ExecutionOutcome error(Throwable throwable) {
        return new ExecutionOutcome(Kind.ERROR, null, String.valueOf(throwable.getMessage()),
                stackTraceOf(throwable), false);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    /**
     * Return value of a successful run; always null for other kinds.
     */
    public Object getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    public String getTrace() {
        return trace;
    }

    /**
     * Whether the failure message is already present in the job log.
     */
    public boolean isLogged() {
        return logged;
    }

    public static String stackTraceOf(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "Success{" + value + "}";
            case FAILURE -> "Failure{" + message + "}";
            case ERROR -> "Error{" + message + "}";
        };
    }
}
