package com.shiprule.cost;

/**
 * Flat cost per matched group.
 */
public record FixedCostRule(double baseCost) implements CostRule {

    @Override
    public CostRuleType type() {
        return CostRuleType.FIXED;
    }
}
