package com.shiprule.condition.impl;

import com.shiprule.condition.ConditionType;
import com.shiprule.variable.VariableResolver;

/**
 * Condition that checks if a field value starts with the value.
 */
public class StartsWithCondition extends StringCondition {

    public StartsWithCondition(String field, String value, boolean caseSensitive, VariableResolver resolver) {
        super(field, value, caseSensitive, resolver);
    }

    @Override
    protected boolean test(String actual, String expected) {
        return actual.startsWith(expected);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.STARTS_WITH;
    }
}
