package com.shiprule.cost;

/**
 * Shipping charged to the customer plus an adjustment, never below zero.
 */
public record ShippingChargedCostRule(double adjustment) implements CostRule {

    @Override
    public CostRuleType type() {
        return CostRuleType.BASED_ON_SHIPPING_CHARGED;
    }
}
