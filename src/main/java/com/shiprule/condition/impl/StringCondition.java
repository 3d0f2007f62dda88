package com.shiprule.condition.impl;

import com.shiprule.condition.Condition;
import com.shiprule.core.MatchRecord;
import com.shiprule.variable.VariableResolver;

import java.util.Locale;

/**
 * Base for conditions comparing the stringified field value against a string value.
 * Both sides are lower-cased unless the condition is case sensitive.
 * A missing field compares as the empty string.
 */
abstract class StringCondition implements Condition {

    protected final String field;
    protected final String value;
    protected final boolean caseSensitive;
    private final VariableResolver resolver;

    StringCondition(String field, String value, boolean caseSensitive, VariableResolver resolver) {
        this.field = field;
        this.value = value == null ? "" : value;
        this.caseSensitive = caseSensitive;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(MatchRecord record) {
        String actual = resolver.resolveAsString(field, record);
        if (caseSensitive) {
            return test(actual, value);
        }
        return test(actual.toLowerCase(Locale.ROOT), value.toLowerCase(Locale.ROOT));
    }

    /**
     * Compare normalized values.
     *
     * @param actual   Field value
     * @param expected Condition value
     */
    protected abstract boolean test(String actual, String expected);

    @Override
    public String toString() {
        return field + " " + getType() + " '" + value + "'" + (caseSensitive ? " (case sensitive)" : "");
    }
}
