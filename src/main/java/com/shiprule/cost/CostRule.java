package com.shiprule.cost;

/**
 * A cost formula attached to a shipping profile.
 * Each variant is a record; {@link #type()} identifies which one.
 */
public interface CostRule {

    CostRuleType type();
}
