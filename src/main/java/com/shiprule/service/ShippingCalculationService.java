package com.shiprule.service;

import com.shiprule.calculation.CalculationResult;
import com.shiprule.calculation.ShippingCostCalculator;
import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;
import com.shiprule.exception.NoActiveProfilesException;
import com.shiprule.exception.OrderNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Calculates and stores the estimated shipping cost of stored orders.
 */
public class ShippingCalculationService {

    private static final Logger log = LoggerFactory.getLogger(ShippingCalculationService.class);

    private final OrderRepository orderRepository;
    private final ProfileRepository profileRepository;
    private final ShippingCostCalculator calculator;

    public ShippingCalculationService(OrderRepository orderRepository,
                                      ProfileRepository profileRepository,
                                      ShippingCostCalculator calculator) {
        this.orderRepository = orderRepository;
        this.profileRepository = profileRepository;
        this.calculator = calculator;
    }

    /**
     * Calculate one order and store the result on it.
     *
     * @param orderId Order id
     * @return Calculation result
     * @throws OrderNotFoundException    if the order does not exist
     * @throws NoActiveProfilesException if no profile is active
     */
    public CalculationResult calculate(String orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        List<ShippingProfile> profiles = activeProfiles();
        return calculateAndStore(order, profiles);
    }

    /**
     * Calculate several orders. A failing order does not stop the others.
     *
     * @param orderIds Order ids
     * @return Successes and failures, in request order
     * @throws NoActiveProfilesException if no profile is active
     */
    public BulkCalculationResult calculateAll(List<String> orderIds) {
        List<ShippingProfile> profiles = activeProfiles();
        List<CalculationResult> successes = new ArrayList<>();
        List<FailedCalculation> failures = new ArrayList<>();

        for (String orderId : orderIds) {
            try {
                Order order = orderRepository.findById(orderId)
                        .orElseThrow(() -> new OrderNotFoundException(orderId));
                successes.add(calculateAndStore(order, profiles));
            } catch (RuntimeException e) {
                log.warn("Shipping calculation failed for order {}: {}", orderId, e.getMessage());
                failures.add(FailedCalculation.of(orderId, e));
            }
        }

        log.info("Calculated shipping for {} order(s), {} failed", successes.size(), failures.size());
        return new BulkCalculationResult(successes, failures);
    }

    private List<ShippingProfile> activeProfiles() {
        List<ShippingProfile> profiles = profileRepository.findActive();
        if (profiles.isEmpty()) {
            throw new NoActiveProfilesException();
        }
        return profiles;
    }

    private CalculationResult calculateAndStore(Order order, List<ShippingProfile> profiles) {
        List<LineItem> items = orderRepository.findItems(order.id());
        CalculationResult result = calculator.calculate(order, items, profiles);
        orderRepository.saveCalculation(order.id(), result);
        log.debug("Order {}: estimated shipping cost {} over {} item(s)",
                order.id(), result.totalCost(), items.size());
        return result;
    }
}
