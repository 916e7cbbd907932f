package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Single-line text. Can enforce a minimum/maximum length and a regular expression.
 * Submitted values are stripped of surrounding whitespace.
 */
public class StringVar extends JobVariable<String, StringVar> {
    private Integer minLength;
    private Integer maxLength;
    private Pattern regex;

    public StringVar() {
        super(String.class);
    }

    @Override
    protected StringVar self() {
        return this;
    }

    public StringVar minLength(int minLength) {
        this.minLength = minLength;
        return this;
    }

    public StringVar maxLength(int maxLength) {
        this.maxLength = maxLength;
        return this;
    }

    public StringVar regex(String regex) {
        this.regex = Pattern.compile(regex);
        return this;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    @Override
    protected String convert(Object raw, VariableServices services) throws ValidationException {
        String value = scalarText(raw).strip();
        if (minLength != null && value.length() < minLength) {
            throw invalid("Ensure this value has at least " + minLength
                    + " characters (it has " + value.length() + ").");
        }
        if (maxLength != null && value.length() > maxLength) {
            throw invalid("Ensure this value has at most " + maxLength
                    + " characters (it has " + value.length() + ").");
        }
        if (regex != null && !regex.matcher(value).find()) {
            throw invalid("Invalid value. Must match regex: " + regex.pattern());
        }
        return value;
    }

    @Override
    protected void describeConstraints(Map<String, Object> description) {
        description.put("min_length", minLength);
        description.put("max_length", maxLength);
        description.put("regex", regex == null ? null : regex.pattern());
    }
}
