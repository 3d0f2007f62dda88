package com.shiprule.cost;

/**
 * One branch of a conditional cost rule.
 *
 * @param ifExpression Comparison expression (e.g., "order_subtotal >= 49")
 * @param then         Cost when the expression holds
 * @param otherwise    Fallback cost (nullable); only read from the last branch
 */
public record ConditionalBranch(String ifExpression, double then, Double otherwise) {

    public static ConditionalBranch of(String ifExpression, double then) {
        return new ConditionalBranch(ifExpression, then, null);
    }
}
