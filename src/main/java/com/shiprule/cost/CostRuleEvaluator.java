package com.shiprule.cost;

/**
 * Computes the cost a rule yields for a group of items.
 */
public interface CostRuleEvaluator {

    /**
     * Evaluate a cost rule.
     *
     * @param rule    Cost rule (null costs zero)
     * @param context Numeric variables for the group
     * @return Cost in the order currency; never throws
     */
    double evaluate(CostRule rule, CostContext context);
}
