package com.jobrunner.vars;

import com.jobrunner.core.DomainObject;
import com.jobrunner.core.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shared declaration of a reference to inventory objects of one type.
 *
 * <p>Query params restrict which objects are acceptable: each entry must equal
 * {@link DomainObject#getAttribute(String)} of the chosen object, compared as text.</p>
 */
public abstract class AbstractObjectVar<T, S extends AbstractObjectVar<T, S>> extends JobVariable<T, S> {
    private final String modelType;
    private String displayField = "display";
    private final Map<String, Object> queryParams = new LinkedHashMap<>();
    private String nullOption;

    protected AbstractObjectVar(Class<T> valueType, String modelType) {
        super(valueType);
        this.modelType = Objects.requireNonNull(modelType, "modelType");
    }

    protected AbstractObjectVar(String modelType) {
        this.modelType = Objects.requireNonNull(modelType, "modelType");
    }

    public S displayField(String displayField) {
        this.displayField = displayField;
        return self();
    }

    public S queryParam(String name, Object value) {
        queryParams.put(name, value);
        return self();
    }

    /**
     * Label of an explicit "no object" option offered to the user.
     */
    public S nullOption(String nullOption) {
        this.nullOption = nullOption;
        return self();
    }

    public String getModelType() {
        return modelType;
    }

    public String getDisplayField() {
        return displayField;
    }

    public Map<String, Object> getQueryParams() {
        return Collections.unmodifiableMap(queryParams);
    }

    public String getNullOption() {
        return nullOption;
    }

    protected boolean matchesQuery(DomainObject object) {
        for (Map.Entry<String, Object> param : queryParams.entrySet()) {
            Object actual = object.getAttribute(param.getKey());
            if (actual == null || !String.valueOf(actual).equals(String.valueOf(param.getValue()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Read an object id submitted as text, a number, or an already resolved object.
     */
    protected static String idOf(Object raw) throws ValidationException {
        if (raw instanceof DomainObject) {
            return ((DomainObject) raw).getId();
        }
        return scalarText(raw).strip();
    }

    protected void checkKnownType(VariableServices services) throws ValidationException {
        if (!services.getObjectRepository().isKnownType(modelType)) {
            throw invalid("Unknown object type " + modelType + ".");
        }
    }

    @Override
    protected void describeConstraints(Map<String, Object> description) {
        description.put("model", modelType);
        description.put("display_field", displayField);
        description.put("query_params", new LinkedHashMap<>(queryParams));
        description.put("null_option", nullOption);
    }
}
