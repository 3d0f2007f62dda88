package com.shiprule.condition;

import com.shiprule.condition.impl.*;
import com.shiprule.config.MatchConditionConfig;
import com.shiprule.variable.DefaultVariableResolver;
import com.shiprule.variable.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Default implementation of ConditionEvaluator.
 * Factory that creates Condition instances from configuration, failing closed
 * on anything it cannot interpret.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultConditionEvaluator.class);

    private final VariableResolver variableResolver;

    public DefaultConditionEvaluator() {
        this(new DefaultVariableResolver());
    }

    public DefaultConditionEvaluator(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    @Override
    public Condition create(MatchConditionConfig config) {
        if (config == null) {
            return NeverMatchCondition.of("missing condition");
        }

        Optional<ConditionType> type = ConditionType.fromOperator(config.operator());
        if (type.isEmpty()) {
            log.debug("Unknown match operator '{}' on field '{}', condition never matches",
                    config.operator(), config.field());
            return NeverMatchCondition.of("unknown operator '" + config.operator() + "'");
        }

        String field = config.field();
        String value = config.value();
        boolean caseSensitive = config.caseSensitive();

        return switch (type.get()) {
            case CONTAINS -> new ContainsCondition(field, value, caseSensitive, variableResolver);
            case EQUALS -> new EqualsCondition(field, value, caseSensitive, variableResolver);
            case STARTS_WITH -> new StartsWithCondition(field, value, caseSensitive, variableResolver);
            case ENDS_WITH -> new EndsWithCondition(field, value, caseSensitive, variableResolver);
            case REGEX -> createRegexCondition(field, value, caseSensitive);
            case NEVER_MATCH -> NeverMatchCondition.of("explicit never-match");
        };
    }

    private Condition createRegexCondition(String field, String regex, boolean caseSensitive) {
        try {
            return new RegexCondition(field, regex, caseSensitive, variableResolver);
        } catch (PatternSyntaxException e) {
            log.debug("Invalid regex '{}' on field '{}': {}", regex, field, e.getDescription());
            return NeverMatchCondition.of("invalid regex '" + regex + "'");
        }
    }
}
