package com.shiprule.condition.impl;

import com.shiprule.condition.ConditionType;
import com.shiprule.variable.VariableResolver;

/**
 * Condition that checks if a field value ends with the value.
 */
public class EndsWithCondition extends StringCondition {

    public EndsWithCondition(String field, String value, boolean caseSensitive, VariableResolver resolver) {
        super(field, value, caseSensitive, resolver);
    }

    @Override
    protected boolean test(String actual, String expected) {
        return actual.endsWith(expected);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ENDS_WITH;
    }
}
