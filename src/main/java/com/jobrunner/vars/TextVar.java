package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

/**
 * Free-form, possibly multi-line text.
 */
public class TextVar extends JobVariable<String, TextVar> {

    public TextVar() {
        super(String.class);
    }

    @Override
    protected TextVar self() {
        return this;
    }

    @Override
    protected String convert(Object raw, VariableServices services) throws ValidationException {
        return scalarText(raw).strip();
    }
}
