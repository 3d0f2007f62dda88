package com.shiprule.calculation;

import java.util.List;

/**
 * Estimated shipping cost of an order with its audit trail.
 *
 * @param orderId      Order id
 * @param totalCost    Sum of all group costs
 * @param breakdown    One entry per profile group, in first-seen order
 * @param matchedItems One entry per item, in item order
 */
public record CalculationResult(
        String orderId,
        double totalCost,
        List<BreakdownEntry> breakdown,
        List<MatchedItem> matchedItems
) {
    public CalculationResult {
        breakdown = breakdown != null ? List.copyOf(breakdown) : List.of();
        matchedItems = matchedItems != null ? List.copyOf(matchedItems) : List.of();
    }

    /**
     * Number of items that resolved to no profile.
     */
    public long unmatchedCount() {
        return matchedItems.stream().filter(m -> !m.isMatched()).count();
    }
}
