package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Any number of predefined static choices. Values keep the order they were submitted in.
 */
public class MultiChoiceVar extends AbstractChoiceVar<List<String>, MultiChoiceVar> {

    @Override
    protected MultiChoiceVar self() {
        return this;
    }

    @Override
    protected List<String> castValue(Object value) {
        List<String> values = new ArrayList<>();
        for (Object item : (Collection<?>) value) {
            values.add((String) item);
        }
        return values;
    }

    @Override
    protected List<String> convert(Object raw, VariableServices services) throws ValidationException {
        if (!(raw instanceof Collection)) {
            throw invalid("Enter a list of values.");
        }
        List<String> values = new ArrayList<>();
        for (Object item : (Collection<?>) raw) {
            String value = scalarText(item);
            if (!isChoice(value)) {
                throw invalid(notAChoice(value));
            }
            values.add(value);
        }
        return values;
    }
}
