package com.shiprule.cost;

import com.shiprule.expression.SafeExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default implementation of CostRuleEvaluator.
 */
public class DefaultCostRuleEvaluator implements CostRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultCostRuleEvaluator.class);

    private final SafeExpressionEvaluator expressionEvaluator;

    public DefaultCostRuleEvaluator() {
        this(new SafeExpressionEvaluator());
    }

    public DefaultCostRuleEvaluator(SafeExpressionEvaluator expressionEvaluator) {
        this.expressionEvaluator = expressionEvaluator;
    }

    @Override
    public double evaluate(CostRule rule, CostContext context) {
        if (rule == null) {
            return 0.0;
        }
        CostContext ctx = context != null ? context : CostContext.empty();

        CostRuleType type = rule.type();
        if (type == null) {
            return unrecognized(rule);
        }

        return switch (type) {
            case FIXED -> rule instanceof FixedCostRule fixed ? fixed.baseCost() : unrecognized(rule);
            case PER_ITEM -> rule instanceof PerItemCostRule perItem
                    ? evaluatePerItem(perItem, ctx) : unrecognized(rule);
            case PERCENTAGE -> rule instanceof PercentageCostRule percentage
                    ? evaluatePercentage(percentage, ctx) : unrecognized(rule);
            case BASED_ON_SHIPPING_CHARGED -> rule instanceof ShippingChargedCostRule charged
                    ? evaluateShippingCharged(charged, ctx) : unrecognized(rule);
            case CONDITIONAL -> rule instanceof ConditionalCostRule conditional
                    ? evaluateConditional(conditional, ctx) : unrecognized(rule);
            case UNKNOWN -> unrecognized(rule);
        };
    }

    private double unrecognized(CostRule rule) {
        String name = rule instanceof UnknownCostRule unknown ? unknown.typeName() : String.valueOf(rule.type());
        log.warn("Unrecognized cost rule '{}' ({}), costing 0", name, rule.getClass().getSimpleName());
        return 0.0;
    }

    private double evaluatePerItem(PerItemCostRule rule, CostContext ctx) {
        int quantity = (int) ctx.getOrDefault(CostContext.QUANTITY, 1.0);
        return rule.perItemCost() * quantity;
    }

    private double evaluatePercentage(PercentageCostRule rule, CostContext ctx) {
        double subtotal = ctx.getOrDefault(CostContext.ORDER_SUBTOTAL, 0.0);
        if (subtotal == 0.0) {
            return 0.0;
        }
        return subtotal * (rule.percentage() / 100);
    }

    private double evaluateShippingCharged(ShippingChargedCostRule rule, CostContext ctx) {
        double charged = ctx.getOrDefault(CostContext.SHIPPING_CHARGED, 0.0);
        return Math.max(0.0, charged + rule.adjustment());
    }

    private double evaluateConditional(ConditionalCostRule rule, CostContext ctx) {
        List<ConditionalBranch> branches = rule.branches();

        for (ConditionalBranch branch : branches) {
            if (expressionEvaluator.evaluate(branch.ifExpression(), ctx.variables())) {
                log.debug("Conditional branch '{}' matched, cost {}", branch.ifExpression(), branch.then());
                return branch.then();
            }
        }

        if (!branches.isEmpty()) {
            Double otherwise = branches.get(branches.size() - 1).otherwise();
            if (otherwise != null) {
                return otherwise;
            }
        }
        return rule.baseCost() != null ? rule.baseCost() : 0.0;
    }
}
