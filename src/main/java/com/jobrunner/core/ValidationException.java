package com.jobrunner.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when job input, a schedule or a job policy fails validation.
 *
 * <p>Errors are keyed by the offending field (variable name, or a request field such as
 * {@code crontab}, {@code start_time} or {@code approval_required}). Validation happens
 * before anything is enqueued, so a caller that sees this exception knows the job never ran.</p>
 *
 * <p><b>Example Handling:</b></p>
 * <pre>{@code
 * try {
 *     scheduler.submit(request, "admin");
 * } catch (ValidationException e) {
 *     e.getErrors().forEach((field, messages) -> showError(field, messages));
 * }
 * }</pre>
 *
 * @author Job Queue Team
 */
public class ValidationException extends Exception {

    private final Map<String, List<String>> errors;

    /**
     * Create a validation error for a single field.
     *
     * @param field the offending field name
     * @param message the human-readable problem
     */
    public ValidationException(String field, String message) {
        this(Map.of(field, List.of(message)));
    }

    /**
     * Create a validation error covering several fields.
     *
     * @param errors messages per field, in the order they should be reported
     */
    public ValidationException(Map<String, List<String>> errors) {
        super(format(errors));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.errors = Collections.unmodifiableMap(copy);
    }

    /**
     * Get the messages per field.
     *
     * @return an unmodifiable map of field name to messages
     */
    public Map<String, List<String>> getErrors() {
        return errors;
    }

    /**
     * Check whether the given field was flagged.
     */
    public boolean hasError(String field) {
        return errors.containsKey(field);
    }

    /**
     * Collects errors for several fields before throwing them together.
     */
    public static class Collector {
        private final Map<String, List<String>> errors = new LinkedHashMap<>();

        public Collector add(String field, String message) {
            errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
            return this;
        }

        public Collector addAll(ValidationException e) {
            e.getErrors().forEach((field, messages) -> messages.forEach(m -> add(field, m)));
            return this;
        }

        /**
         * Add the messages of {@code e} under a single field, ignoring the fields it carried.
         */
        public Collector addAllAs(String field, ValidationException e) {
            e.getErrors().values().forEach(messages -> messages.forEach(m -> add(field, m)));
            return this;
        }

        public boolean isEmpty() {
            return errors.isEmpty();
        }

        public void throwIfNotEmpty() throws ValidationException {
            if (!errors.isEmpty()) {
                throw new ValidationException(errors);
            }
        }
    }

    private static String format(Map<String, List<String>> errors) {
        StringBuilder sb = new StringBuilder();
        errors.forEach((field, messages) -> {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(field).append(": ").append(String.join(" ", messages));
        });
        return sb.toString();
    }
}
