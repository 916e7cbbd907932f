package com.jobrunner.changes;

/**
 * Thread-scoped {@link ChangeContext}.
 *
 * <pre>{@code
 * try (ChangeLogging.Scope scope = ChangeLogging.open(ChangeContext.job(user, classPath, resultId))) {
 *     job.run(context, data);
 * }
 * }</pre>
 *
 * <p>Scopes nest; closing one restores the context that was active when it was opened.</p>
 */
public final class ChangeLogging {
    private static final ThreadLocal<ChangeContext> CURRENT = new ThreadLocal<>();

    private ChangeLogging() {
    }

    public static Scope open(ChangeContext context) {
        Scope scope = new Scope(CURRENT.get());
        CURRENT.set(context);
        return scope;
    }

    /**
     * The context active on this thread, or null outside any scope.
     */
    public static ChangeContext current() {
        return CURRENT.get();
    }

    public static final class Scope implements AutoCloseable {
        private final ChangeContext previous;

        private Scope(ChangeContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
