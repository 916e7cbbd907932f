package com.jobrunner.vars;

import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.ValidationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed declaration of one job input.
 *
 * <p>A variable converts a value through three forms:</p>
 * <ul>
 *   <li><b>raw</b>: whatever the caller submitted (JSON scalars, lists, or an {@link com.jobrunner.core.UploadedFile})</li>
 *   <li><b>typed</b>: the Java value the job body receives</li>
 *   <li><b>serialized</b>: a JSON-compatible value stored with the queued task</li>
 * </ul>
 *
 * <p>For kinds that hold plain values {@code deserialize(serialize(x))} equals {@code x}.
 * Object and file kinds serialize to a reference and resolve it again on deserialize.</p>
 *
 * <p>Fluent setters return the concrete variable type, so declarations chain:</p>
 * <pre>{@code
 * new StringVar().label("Hostname").maxLength(64).required(false)
 * }</pre>
 *
 * @param <T> the typed value
 * @param <S> the concrete variable type, returned by the fluent setters
 */
public abstract class JobVariable<T, S extends JobVariable<T, S>> {

    /**
     * Field name used for errors raised by a single variable. Callers re-key them under the
     * variable's name with {@link ValidationException.Collector#addAllAs(String, ValidationException)}.
     */
    public static final String VALUE_FIELD = "__value__";

    public static final String REQUIRED_MESSAGE = "This field is required.";

    private final Class<T> valueType;
    private String label;
    private String description;
    private T defaultValue;
    private boolean required = true;

    protected JobVariable(Class<T> valueType) {
        this.valueType = valueType;
    }

    /**
     * For kinds whose value type is generic; they must override {@link #castValue(Object)}.
     */
    protected JobVariable() {
        this.valueType = null;
    }

    protected abstract S self();

    /**
     * Kind name shown to callers listing variables, e.g. {@code StringVar}.
     */
    public String getType() {
        return getClass().getSimpleName();
    }

    public S label(String label) {
        this.label = label;
        return self();
    }

    public S description(String description) {
        this.description = description;
        return self();
    }

    public S defaultValue(T defaultValue) {
        this.defaultValue = defaultValue;
        return self();
    }

    public S required(boolean required) {
        this.required = required;
        return self();
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public T getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Validate a submitted value.
     *
     * <p>An empty value (null, blank string, empty list) yields the default if one is
     * declared, otherwise null; for a required variable without a default it is an error.</p>
     *
     * @param raw the submitted value
     * @param services collaborators for lookups
     * @return the typed value, or null for an empty optional value
     * @throws ValidationException keyed by {@link #VALUE_FIELD} if the value is not acceptable
     */
    public T validate(Object raw, VariableServices services) throws ValidationException {
        if (isEmpty(raw)) {
            if (defaultValue != null) {
                return defaultValue;
            }
            if (isRequired()) {
                throw invalid(REQUIRED_MESSAGE);
            }
            return emptyValue();
        }
        return convert(raw, services);
    }

    /**
     * Convert a non-empty raw value and check the kind's constraints.
     */
    protected abstract T convert(Object raw, VariableServices services) throws ValidationException;

    /**
     * Value used when an optional variable was left empty.
     */
    protected T emptyValue() {
        return null;
    }

    /**
     * Convert a typed value into its stored JSON form. Plain kinds store the value itself.
     */
    public Object serialize(T value, VariableServices services) {
        return value;
    }

    /**
     * Serialize a value whose type was checked only at run time.
     *
     * @throws ClassCastException if the value is not of this variable's type
     */
    public Object serializeUnchecked(Object value, VariableServices services) {
        if (value == null) {
            return null;
        }
        return serialize(castValue(value), services);
    }

    /**
     * @throws ClassCastException if the value is not of this variable's type
     */
    protected T castValue(Object value) {
        return valueType.cast(value);
    }

    /**
     * Rebuild the typed value from its stored JSON form.
     *
     * @throws ObjectNotFoundException if a referenced object or file no longer exists
     * @throws ValidationException if the stored value cannot be converted
     */
    public T deserialize(Object stored, VariableServices services)
            throws ObjectNotFoundException, ValidationException {
        if (stored == null) {
            return emptyValue();
        }
        return convert(stored, services);
    }

    /**
     * Describe the declaration for callers listing a job's variables.
     *
     * @param name the variable's name on its job
     * @return an ordered map of the declared attributes
     */
    public Map<String, Object> describe(String name) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", name);
        description.put("type", getType());
        description.put("label", label);
        description.put("help_text", this.description);
        description.put("default", defaultValue == null ? null : describeDefault(defaultValue));
        description.put("required", isRequired());
        describeConstraints(description);
        return description;
    }

    protected Object describeDefault(T value) {
        return serialize(value, null);
    }

    /**
     * Add kind-specific constraints to {@link #describe(String)}.
     */
    protected void describeConstraints(Map<String, Object> description) {
    }

    protected boolean isEmpty(Object raw) {
        if (raw == null) {
            return true;
        }
        if (raw instanceof CharSequence) {
            return raw.toString().strip().isEmpty();
        }
        if (raw instanceof Collection) {
            return ((Collection<?>) raw).isEmpty();
        }
        return false;
    }

    protected static ValidationException invalid(String message) {
        return new ValidationException(VALUE_FIELD, message);
    }

    /**
     * Read a scalar submitted as text or as a JSON number/boolean.
     */
    protected static String scalarText(Object raw) throws ValidationException {
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean) {
            return raw.toString();
        }
        throw invalid("Enter a valid value.");
    }
}
