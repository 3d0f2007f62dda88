package com.shiprule.calculation;

import java.util.List;

/**
 * Cost of one group of items sharing a profile.
 *
 * @param profileId   Profile id
 * @param profileName Profile name
 * @param items       Product titles of the grouped items
 * @param subtotal    Sum of the grouped line totals
 * @param cost        Cost the profile's rule yielded for the group
 */
public record BreakdownEntry(
        String profileId,
        String profileName,
        List<String> items,
        double subtotal,
        double cost
) {
    public BreakdownEntry {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
