package com.shiprule.service;

import com.shiprule.calculation.CalculationResult;

import java.util.List;

/**
 * Outcome of calculating several orders.
 *
 * @param successes Calculations that completed, in request order
 * @param failures  Orders that failed, in request order
 */
public record BulkCalculationResult(
        List<CalculationResult> successes,
        List<FailedCalculation> failures
) {
    public BulkCalculationResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public int successCount() {
        return successes.size();
    }

    public int failureCount() {
        return failures.size();
    }

    public double totalCost() {
        return successes.stream().mapToDouble(CalculationResult::totalCost).sum();
    }
}
