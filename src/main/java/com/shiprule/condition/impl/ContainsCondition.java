package com.shiprule.condition.impl;

import com.shiprule.condition.ConditionType;
import com.shiprule.variable.VariableResolver;

/**
 * Condition that checks if a field value contains the value as a substring.
 * An empty value always matches.
 */
public class ContainsCondition extends StringCondition {

    public ContainsCondition(String field, String value, boolean caseSensitive, VariableResolver resolver) {
        super(field, value, caseSensitive, resolver);
    }

    @Override
    protected boolean test(String actual, String expected) {
        return actual.contains(expected);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.CONTAINS;
    }
}
