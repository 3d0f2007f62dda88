package com.shiprule.cost;

import java.util.List;

/**
 * Ordered list of branches; the first branch whose expression holds decides the cost.
 *
 * @param branches Branches in evaluation order
 * @param baseCost Cost when nothing matches and the last branch has no fallback (nullable)
 */
public record ConditionalCostRule(List<ConditionalBranch> branches, Double baseCost) implements CostRule {

    public ConditionalCostRule {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    @Override
    public CostRuleType type() {
        return CostRuleType.CONDITIONAL;
    }
}
