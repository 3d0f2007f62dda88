package com.shiprule.cost;

/**
 * Cost multiplied by the quantity of units in the group.
 */
public record PerItemCostRule(double perItemCost) implements CostRule {

    @Override
    public CostRuleType type() {
        return CostRuleType.PER_ITEM;
    }
}
