package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

import java.util.Locale;

/**
 * True/false flag. Never required: a missing value means false.
 */
public class BooleanVar extends JobVariable<Boolean, BooleanVar> {

    public BooleanVar() {
        super(Boolean.class);
        required(false);
    }

    @Override
    protected BooleanVar self() {
        return this;
    }

    /**
     * Ignored; boolean variables cannot be required.
     */
    @Override
    public BooleanVar required(boolean required) {
        return super.required(false);
    }

    @Override
    protected Boolean emptyValue() {
        return Boolean.FALSE;
    }

    @Override
    protected Boolean convert(Object raw, VariableServices services) throws ValidationException {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        String text = scalarText(raw).strip().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "on", "yes", "1" -> Boolean.TRUE;
            case "false", "off", "no", "0" -> Boolean.FALSE;
            default -> throw invalid("Enter a valid boolean.");
        };
    }
}
