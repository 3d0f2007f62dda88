package com.shiprule.condition.impl;

import com.shiprule.condition.ConditionType;
import com.shiprule.variable.VariableResolver;

/**
 * Condition that checks if a field value is exactly equal to the value.
 */
public class EqualsCondition extends StringCondition {

    public EqualsCondition(String field, String value, boolean caseSensitive, VariableResolver resolver) {
        super(field, value, caseSensitive, resolver);
    }

    @Override
    protected boolean test(String actual, String expected) {
        return actual.equals(expected);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EQUALS;
    }
}
