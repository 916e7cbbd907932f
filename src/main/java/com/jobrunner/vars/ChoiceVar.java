package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

/**
 * One of several predefined static choices.
 *
 * <pre>{@code
 * new ChoiceVar()
 *     .choice("#ff0000", "Red")
 *     .choice("#00ff00", "Green")
 * }</pre>
 */
public class ChoiceVar extends AbstractChoiceVar<String, ChoiceVar> {

    public ChoiceVar() {
        super(String.class);
    }

    @Override
    protected ChoiceVar self() {
        return this;
    }

    @Override
    protected String convert(Object raw, VariableServices services) throws ValidationException {
        String value = scalarText(raw);
        if (!isChoice(value)) {
            throw invalid(notAChoice(value));
        }
        return value;
    }
}
