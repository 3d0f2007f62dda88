package com.shiprule.condition.impl;

import com.shiprule.condition.Condition;
import com.shiprule.condition.ConditionType;
import com.shiprule.core.MatchRecord;

/**
 * Condition that never matches. Stands in for malformed conditions.
 */
public final class NeverMatchCondition implements Condition {

    private final String reason;

    private NeverMatchCondition(String reason) {
        this.reason = reason;
    }

    public static NeverMatchCondition of(String reason) {
        return new NeverMatchCondition(reason);
    }

    @Override
    public boolean evaluate(MatchRecord record) {
        return false;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NEVER_MATCH;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "NEVER (" + reason + ")";
    }
}
