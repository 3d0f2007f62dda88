package com.shiprule.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a profile dry run.
 *
 * @param matched        Whether the profile's condition held for the test data
 * @param calculatedCost Cost the profile's rule yields, null when not matched
 * @param details        Conditions, cost rule and test data used, empty when not matched
 */
public record ProfileTestResult(
        boolean matched,
        Double calculatedCost,
        Map<String, Object> details
) {
    public ProfileTestResult {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static ProfileTestResult notMatched() {
        return new ProfileTestResult(false, null, Map.of());
    }
}
