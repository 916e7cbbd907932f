package com.jobrunner.vars;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared declaration of a static choice set: value to label, in display order.
 */
public abstract class AbstractChoiceVar<T, S extends AbstractChoiceVar<T, S>> extends JobVariable<T, S> {
    private final Map<String, String> choices = new LinkedHashMap<>();

    protected AbstractChoiceVar(Class<T> valueType) {
        super(valueType);
    }

    protected AbstractChoiceVar() {
    }

    public S choice(String value, String label) {
        choices.put(value, label);
        return self();
    }

    public S choices(Map<String, String> choices) {
        this.choices.putAll(choices);
        return self();
    }

    public Map<String, String> getChoices() {
        return Collections.unmodifiableMap(choices);
    }

    protected boolean isChoice(String value) {
        return choices.containsKey(value);
    }

    protected static String notAChoice(String value) {
        return "Select a valid choice. " + value + " is not one of the available choices.";
    }

    @Override
    protected void describeConstraints(Map<String, Object> description) {
        List<List<String>> pairs = new ArrayList<>();
        choices.forEach((value, label) -> pairs.add(List.of(value, label)));
        description.put("choices", pairs);
    }
}
