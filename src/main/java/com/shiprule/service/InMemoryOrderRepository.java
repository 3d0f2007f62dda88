package com.shiprule.service;

import com.shiprule.calculation.CalculationResult;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of OrderRepository.
 *
 * <p>Orders are lost on restart. All operations are thread-safe.
 */
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentMap<String, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<LineItem>> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CalculationResult> calculations = new ConcurrentHashMap<>();

    /**
     * Store an order with its items. Any earlier calculation of the order is cleared.
     */
    public void save(Order order, List<LineItem> lineItems) {
        orders.put(order.id(), order);
        items.put(order.id(), lineItems != null ? List.copyOf(lineItems) : List.of());
        calculations.remove(order.id());
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return orderId == null ? Optional.empty() : Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<LineItem> findItems(String orderId) {
        return orderId == null ? List.of() : items.getOrDefault(orderId, List.of());
    }

    @Override
    public List<String> findOrdersWithoutCalculation() {
        return orders.keySet().stream()
                .filter(id -> !calculations.containsKey(id))
                .sorted()
                .toList();
    }

    @Override
    public void saveCalculation(String orderId, CalculationResult result) {
        if (!orders.containsKey(orderId)) {
            throw new IllegalArgumentException("Unknown order: " + orderId);
        }
        calculations.put(orderId, result);
    }

    @Override
    public Optional<CalculationResult> findCalculation(String orderId) {
        return orderId == null ? Optional.empty() : Optional.ofNullable(calculations.get(orderId));
    }
}
