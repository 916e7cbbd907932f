package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Whole number. Can enforce a minimum/maximum value.
 */
public class IntegerVar extends JobVariable<Integer, IntegerVar> {
    private Integer minValue;
    private Integer maxValue;

    public IntegerVar() {
        super(Integer.class);
    }

    @Override
    protected IntegerVar self() {
        return this;
    }

    public IntegerVar minValue(int minValue) {
        this.minValue = minValue;
        return this;
    }

    public IntegerVar maxValue(int maxValue) {
        this.maxValue = maxValue;
        return this;
    }

    @Override
    protected Integer convert(Object raw, VariableServices services) throws ValidationException {
        int value = toInt(raw);
        if (minValue != null && value < minValue) {
            throw invalid("Ensure this value is greater than or equal to " + minValue + ".");
        }
        if (maxValue != null && value > maxValue) {
            throw invalid("Ensure this value is less than or equal to " + maxValue + ".");
        }
        return value;
    }

    private static int toInt(Object raw) throws ValidationException {
        if (raw instanceof Boolean) {
            throw invalid("Enter a whole number.");
        }
        try {
            // JSON parsers hand numbers back as Integer, Long, Double or BigDecimal
            return new BigDecimal(scalarText(raw).strip()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw invalid("Enter a whole number.");
        }
    }

    @Override
    protected void describeConstraints(Map<String, Object> description) {
        description.put("min_value", minValue);
        description.put("max_value", maxValue);
    }
}
