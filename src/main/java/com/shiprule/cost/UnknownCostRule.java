package com.shiprule.cost;

/**
 * Cost rule with a type name the engine does not recognize. Always costs zero.
 */
public record UnknownCostRule(String typeName) implements CostRule {

    @Override
    public CostRuleType type() {
        return CostRuleType.UNKNOWN;
    }
}
