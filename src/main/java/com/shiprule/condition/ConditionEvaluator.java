package com.shiprule.condition;

import com.shiprule.config.MatchConditionConfig;
import com.shiprule.core.MatchRecord;

/**
 * Factory and evaluator for match conditions.
 */
public interface ConditionEvaluator {

    /**
     * Create a Condition instance from configuration.
     * Malformed configuration yields a condition that never matches.
     *
     * @param config Condition configuration
     * @return Condition instance, never null
     */
    Condition create(MatchConditionConfig config);

    /**
     * Evaluate a condition configuration directly against a record.
     *
     * @param config Condition configuration
     * @param record Match record
     * @return true if condition matches, false otherwise
     */
    default boolean evaluate(MatchConditionConfig config, MatchRecord record) {
        return create(config).evaluate(record);
    }
}
