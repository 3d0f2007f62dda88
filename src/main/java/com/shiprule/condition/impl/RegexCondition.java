package com.shiprule.condition.impl;

import com.shiprule.condition.Condition;
import com.shiprule.condition.ConditionType;
import com.shiprule.core.MatchRecord;
import com.shiprule.variable.VariableResolver;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Condition that checks if a regular expression matches anywhere in a field value.
 * Unless case sensitive, both the pattern text and the field value are lower-cased first,
 * so {@code \D} is read as {@code \d}.
 */
public class RegexCondition implements Condition {

    private final String field;
    private final Pattern pattern;
    private final boolean caseSensitive;
    private final VariableResolver resolver;

    /**
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public RegexCondition(String field, String regex, boolean caseSensitive, VariableResolver resolver) {
        this.field = field;
        this.caseSensitive = caseSensitive;
        String text = regex == null ? "" : regex;
        this.pattern = caseSensitive
                ? Pattern.compile(text)
                : Pattern.compile(text.toLowerCase(Locale.ROOT), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(MatchRecord record) {
        String value = resolver.resolveAsString(field, record);
        if (!caseSensitive) {
            value = value.toLowerCase(Locale.ROOT);
        }
        return pattern.matcher(value).find();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.REGEX;
    }

    @Override
    public String toString() {
        return field + " MATCHES /" + pattern.pattern() + "/";
    }
}
