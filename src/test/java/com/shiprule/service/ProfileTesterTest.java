package com.shiprule.service;

import com.shiprule.condition.DefaultConditionEvaluator;
import com.shiprule.config.MatchConditionConfig;
import com.shiprule.config.ShippingProfile;
import com.shiprule.cost.ConditionalBranch;
import com.shiprule.cost.ConditionalCostRule;
import com.shiprule.cost.DefaultCostRuleEvaluator;
import com.shiprule.cost.PerItemCostRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProfileTester.
 */
class ProfileTesterTest {

    private ProfileTester tester;
    private ShippingProfile trees;

    @BeforeEach
    void setUp() {
        tester = new ProfileTester(new DefaultConditionEvaluator(), new DefaultCostRuleEvaluator());
        trees = ShippingProfile.builder("trees", "Trees")
                .matchConditions(MatchConditionConfig.contains("product_title", "tree"))
                .costRule(new PerItemCostRule(15.0))
                .build();
    }

    @Test
    @DisplayName("Should match and price test data")
    void shouldMatchAndPrice() {
        ProfileTestResult result = tester.test(trees, Map.of("product_title", "Tree Decoration", "quantity", 2));

        assertTrue(result.matched());
        assertEquals(30.0, result.calculatedCost());
        assertEquals(trees.matchConditions(), result.details().get("match_conditions"));
        assertEquals(trees.costRule(), result.details().get("cost_rule"));
        assertNotNull(result.details().get("test_data"));
    }

    @Test
    @DisplayName("Should count a fractional test quantity as whole items")
    void shouldTruncateFractionalQuantity() {
        ProfileTestResult result = tester.test(trees, Map.of("product_title", "Tree Decoration", "quantity", 2.5));

        assertTrue(result.matched());
        assertEquals(30.0, result.calculatedCost());
    }

    @Test
    @DisplayName("Should report no cost and no details when not matched")
    void shouldReportNotMatched() {
        ProfileTestResult result = tester.test(trees, Map.of("product_title", "Desk Lamp", "quantity", 2));

        assertFalse(result.matched());
        assertNull(result.calculatedCost());
        assertTrue(result.details().isEmpty());
    }

    @Test
    @DisplayName("Should accept JSON test data with numeric strings")
    void shouldAcceptJson() {
        ShippingProfile tiered = ShippingProfile.builder("tiered", "Tiered")
                .matchConditions(MatchConditionConfig.contains("product_title", ""))
                .costRule(new ConditionalCostRule(List.of(
                        ConditionalBranch.of("order_subtotal >= 100", 0),
                        new ConditionalBranch("order_subtotal >= 49", 5, 12.0)), null))
                .build();

        ProfileTestResult result = tester.test(tiered, """
                {"product_title": "Anything", "order_subtotal": "50"}
                """);

        assertTrue(result.matched());
        assertEquals(5.0, result.calculatedCost());
    }

    @Test
    @DisplayName("Should reject invalid JSON test data")
    void shouldRejectInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> tester.test(trees, "{oops"));
    }
}
