package com.shiprule.calculation;

import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;

import java.util.List;

/**
 * Estimates what fulfilling an order costs the merchant.
 */
public interface ShippingCostCalculator {

    /**
     * Calculate the shipping cost of an order.
     * Pure: the same inputs always give the same result and nothing given is modified.
     *
     * @param order    Order
     * @param items    Line items of the order
     * @param profiles Candidate profiles; inactive ones are ignored
     * @return Calculation result
     */
    CalculationResult calculate(Order order, List<LineItem> items, List<ShippingProfile> profiles);
}
