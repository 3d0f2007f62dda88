package com.shiprule.cost;

/**
 * Percentage of the order subtotal.
 */
public record PercentageCostRule(double percentage) implements CostRule {

    @Override
    public CostRuleType type() {
        return CostRuleType.PERCENTAGE;
    }
}
