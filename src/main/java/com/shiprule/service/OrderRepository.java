package com.shiprule.service;

import com.shiprule.calculation.CalculationResult;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;

import java.util.List;
import java.util.Optional;

/**
 * Access to stored orders and their shipping calculations.
 */
public interface OrderRepository {

    Optional<Order> findById(String orderId);

    /**
     * Get the line items of an order, in storefront order.
     */
    List<LineItem> findItems(String orderId);

    /**
     * Get the ids of orders that have no stored calculation yet.
     */
    List<String> findOrdersWithoutCalculation();

    /**
     * Store the estimated cost and calculation details of an order.
     * Replaces any earlier calculation.
     */
    void saveCalculation(String orderId, CalculationResult result);

    Optional<CalculationResult> findCalculation(String orderId);
}
