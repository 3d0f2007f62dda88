package com.shiprule.condition;

import com.shiprule.core.MatchRecord;

/**
 * Represents a boolean condition that can be evaluated against a match record.
 * Implementations never throw.
 */
public interface Condition {

    /**
     * Evaluate this condition against the given record.
     *
     * @param record Merged order and item fields
     * @return true if condition matches, false otherwise
     */
    boolean evaluate(MatchRecord record);

    /**
     * Get the condition type.
     */
    ConditionType getType();
}
