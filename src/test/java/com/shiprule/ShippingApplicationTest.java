package com.shiprule;

import com.shiprule.calculation.CalculationResult;
import com.shiprule.calculation.DefaultShippingCostCalculator;
import com.shiprule.calculation.ShippingCostCalculator;
import com.shiprule.config.ProfileLoader;
import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;
import com.shiprule.resolver.MatchType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scenario tests running orders through profiles loaded from YAML.
 * Tests cover:
 * - Routing items to profiles by title
 * - Default profile fallback
 * - Inactive profiles
 * - Conditional tiers once activated
 */
class ShippingApplicationTest {

    private ShippingCostCalculator calculator;
    private List<ShippingProfile> profiles;

    @BeforeEach
    void setUp() {
        calculator = new DefaultShippingCostCalculator();
        profiles = ProfileLoader.load("classpath:test-profiles.yaml");
    }

    // =====================================================================
    // Routing Tests
    // =====================================================================

    @ParameterizedTest
    @CsvSource({
            "2 Plug Adapter,    1, 50,  plugs,    12",
            "2 PLUG adapter XL, 3, 90,  plugs,    12",
            "Tree Decoration,   2, 100, trees,    30",
            "tree stand,        1, 20,  trees,    15",
            "Desk Lamp,         4, 80,  fallback, 8",
            "Christmas Tree,    1, 60,  fallback, 8"
    })
    @DisplayName("Should route a single item to the expected profile")
    void shouldRouteItem(String title, int quantity, double total, String expectedProfile, double expectedCost) {
        Order order = Order.of("order-1", total, 10.0);

        CalculationResult result = calculator.calculate(order,
                List.of(LineItem.of(title, quantity, total / quantity, total)), profiles);

        assertEquals(expectedProfile, result.matchedItems().get(0).profileId());
        assertEquals(expectedCost, result.totalCost());
    }

    @Test
    @DisplayName("Should price the documented mixed order at 42")
    void shouldPriceMixedOrder() {
        Order order = Order.of("order-1", 150.0, 20.0);
        List<LineItem> items = List.of(
                LineItem.of("2 Plug Adapter", 1, 50.0, 50.0),
                LineItem.of("Tree Decoration", 2, 50.0, 100.0));

        CalculationResult result = calculator.calculate(order, items, profiles);

        assertEquals(42.0, result.totalCost());
        assertEquals(2, result.breakdown().size());
    }

    // =====================================================================
    // Default and Inactive Profile Tests
    // =====================================================================

    @Test
    @DisplayName("Should group every unmatched item under the default profile once")
    void shouldGroupDefaultItems() {
        Order order = Order.of("order-2", 60.0, 0.0);
        List<LineItem> items = List.of(
                LineItem.of("Desk Lamp", 1, 30.0, 30.0),
                LineItem.of("Chair", 1, 30.0, 30.0));

        CalculationResult result = calculator.calculate(order, items, profiles);

        assertEquals(8.0, result.totalCost());
        assertEquals(1, result.breakdown().size());
        assertTrue(result.matchedItems().stream().allMatch(m -> m.matchType() == MatchType.DEFAULT));
    }

    @Test
    @DisplayName("Should leave items unmatched once the default profile is removed")
    void shouldLeaveItemsUnmatchedWithoutDefault() {
        List<ShippingProfile> withoutDefault = profiles.stream().filter(p -> !p.defaultProfile()).toList();

        CalculationResult result = calculator.calculate(Order.of("order-3", 30.0, 0.0),
                List.of(LineItem.of("Desk Lamp", 1, 30.0, 30.0)), withoutDefault);

        assertEquals(0.0, result.totalCost());
        assertTrue(result.breakdown().isEmpty());
        assertEquals("No Rule Match", result.matchedItems().get(0).profileName());
    }

    // =====================================================================
    // Conditional Tier Tests
    // =====================================================================

    @ParameterizedTest
    @CsvSource({
            "150, 0",
            "60,  5",
            "20,  12"
    })
    @DisplayName("Should apply conditional tiers once the tiered profile is active")
    void shouldApplyTiers(double subtotal, double expected) {
        List<ShippingProfile> activated = new ArrayList<>();
        for (ShippingProfile profile : profiles) {
            if (profile.id().equals("tiered")) {
                activated.add(ShippingProfile.builder(profile.id(), profile.name())
                        .priority(profile.priority())
                        .matchConditions(profile.matchConditions())
                        .costRule(profile.costRule())
                        .build());
            } else {
                activated.add(profile);
            }
        }

        CalculationResult result = calculator.calculate(Order.of("order-4", subtotal, 0.0),
                List.of(LineItem.of("Desk Lamp", 1, subtotal, subtotal)), activated);

        assertEquals("tiered", result.matchedItems().get(0).profileId());
        assertEquals(expected, result.totalCost());
    }
}
