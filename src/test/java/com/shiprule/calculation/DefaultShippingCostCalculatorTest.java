package com.shiprule.calculation;

import com.shiprule.config.MatchConditionConfig;
import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;
import com.shiprule.cost.ConditionalBranch;
import com.shiprule.cost.ConditionalCostRule;
import com.shiprule.cost.FixedCostRule;
import com.shiprule.cost.PerItemCostRule;
import com.shiprule.cost.UnknownCostRule;
import com.shiprule.resolver.MatchType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultShippingCostCalculator.
 */
class DefaultShippingCostCalculatorTest {

    private ShippingCostCalculator calculator;
    private Order order;
    private List<LineItem> items;
    private List<ShippingProfile> profiles;

    @BeforeEach
    void setUp() {
        calculator = new DefaultShippingCostCalculator();
        order = Order.of("order-1", 150.0, 20.0);
        items = List.of(
                LineItem.of("2 Plug Adapter", 1, 50.0, 50.0),
                LineItem.of("Tree Decoration", 2, 50.0, 100.0));
        profiles = List.of(
                ShippingProfile.builder("plugs", "Plugs")
                        .priority(10)
                        .matchConditions(MatchConditionConfig.contains("product_title", "2 plug"))
                        .costRule(new FixedCostRule(12.0))
                        .build(),
                ShippingProfile.builder("trees", "Trees")
                        .priority(20)
                        .matchConditions(MatchConditionConfig.contains("product_title", "tree"))
                        .costRule(new PerItemCostRule(15.0))
                        .build());
    }

    @Test
    @DisplayName("Should price each profile group and sum the groups")
    void shouldCalculateEndToEnd() {
        CalculationResult result = calculator.calculate(order, items, profiles);

        assertEquals("order-1", result.orderId());
        assertEquals(42.0, result.totalCost());
        assertEquals(2, result.breakdown().size());

        BreakdownEntry plugs = result.breakdown().get(0);
        assertEquals("plugs", plugs.profileId());
        assertEquals(List.of("2 Plug Adapter"), plugs.items());
        assertEquals(50.0, plugs.subtotal());
        assertEquals(12.0, plugs.cost());

        BreakdownEntry trees = result.breakdown().get(1);
        assertEquals("trees", trees.profileId());
        assertEquals(100.0, trees.subtotal());
        assertEquals(30.0, trees.cost());
    }

    @Test
    @DisplayName("Should list groups in first-seen item order")
    void shouldKeepFirstSeenGroupOrder() {
        List<LineItem> reversed = List.of(items.get(1), items.get(0), LineItem.of("Tree Topper", 1, 5.0, 5.0));

        CalculationResult result = calculator.calculate(order, reversed, profiles);

        assertEquals(List.of("trees", "plugs"), result.breakdown().stream().map(BreakdownEntry::profileId).toList());
        assertEquals(List.of("Tree Decoration", "Tree Topper"), result.breakdown().get(0).items());
        assertEquals(105.0, result.breakdown().get(0).subtotal());
        assertEquals(45.0, result.breakdown().get(0).cost());
    }

    @Test
    @DisplayName("Should price the default profile when nothing else matches")
    void shouldFallBackToDefault() {
        ShippingProfile fallback = ShippingProfile.builder("fallback", "Fallback")
                .defaultProfile(true)
                .matchConditions(MatchConditionConfig.equalTo("product_title", "nothing"))
                .costRule(new FixedCostRule(8.0))
                .build();
        List<LineItem> lamp = List.of(LineItem.of("Desk Lamp", 1, 30.0, 30.0));

        CalculationResult result = calculator.calculate(order, lamp, List.of(fallback));

        assertEquals(8.0, result.totalCost());
        assertEquals(MatchType.DEFAULT, result.matchedItems().get(0).matchType());
    }

    @Test
    @DisplayName("Should audit unmatched items at zero cost")
    void shouldAuditUnmatchedItems() {
        List<LineItem> mixed = List.of(items.get(0), LineItem.of("Desk Lamp", 1, 30.0, 30.0));

        CalculationResult result = calculator.calculate(order, mixed, profiles);

        assertEquals(12.0, result.totalCost());
        assertEquals(1, result.breakdown().size());
        assertEquals(2, result.matchedItems().size());
        MatchedItem lamp = result.matchedItems().get(1);
        assertNull(lamp.profileId());
        assertEquals(MatchedItem.NO_RULE_MATCH, lamp.profileName());
        assertFalse(lamp.isMatched());
        assertEquals(1, result.unmatchedCount());
    }

    @Test
    @DisplayName("Should return an empty result for an order without items")
    void shouldHandleNoItems() {
        CalculationResult result = calculator.calculate(order, List.of(), profiles);

        assertEquals(0.0, result.totalCost());
        assertTrue(result.breakdown().isEmpty());
        assertTrue(result.matchedItems().isEmpty());
    }

    @Test
    @DisplayName("Should feed group totals into conditional rules")
    void shouldFeedGroupContext() {
        ShippingProfile tiered = ShippingProfile.builder("tiered", "Tiered")
                .matchConditions(MatchConditionConfig.contains("product_title", ""))
                .costRule(new ConditionalCostRule(List.of(
                        ConditionalBranch.of("group_subtotal >= 150 and quantity == 3", 1),
                        ConditionalBranch.of("group_subtotal >= 150", 2),
                        new ConditionalBranch("quantity == 3", 3, 4.0)), null))
                .build();

        CalculationResult result = calculator.calculate(order, items, List.of(tiered));

        assertEquals(1, result.breakdown().size());
        assertEquals(2.0, result.totalCost());
    }

    @Test
    @DisplayName("Should cost groups with an unknown rule at zero")
    void shouldCostUnknownRuleAtZero() {
        ShippingProfile weird = ShippingProfile.builder("weird", "Weird")
                .matchConditions(MatchConditionConfig.contains("product_title", "plug"))
                .costRule(new UnknownCostRule("weight_based"))
                .build();

        CalculationResult result = calculator.calculate(order, items, List.of(weird, profiles.get(1)));

        assertEquals(30.0, result.totalCost());
        assertEquals(0.0, result.breakdown().get(0).cost());
    }

    @Test
    @DisplayName("Should give equal results for equal inputs")
    void shouldBeIdempotent() {
        CalculationResult first = calculator.calculate(order, items, profiles);
        CalculationResult second = calculator.calculate(order, items, profiles);

        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }
}
