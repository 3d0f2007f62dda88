package com.shiprule.calculation;

import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;
import com.shiprule.cost.CostContext;
import com.shiprule.cost.CostRuleEvaluator;
import com.shiprule.cost.DefaultCostRuleEvaluator;
import com.shiprule.resolver.DefaultProfileResolver;
import com.shiprule.resolver.PreparedProfiles;
import com.shiprule.resolver.ProfileResolver;
import com.shiprule.resolver.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of ShippingCostCalculator.
 * <p>
 * Items are resolved one by one, grouped by profile in first-seen order, and each group is
 * priced once by its profile's cost rule. Items without a profile are only audited.
 */
public class DefaultShippingCostCalculator implements ShippingCostCalculator {

    private static final Logger log = LoggerFactory.getLogger(DefaultShippingCostCalculator.class);

    private final ProfileResolver profileResolver;
    private final CostRuleEvaluator costRuleEvaluator;

    public DefaultShippingCostCalculator() {
        this(new DefaultProfileResolver(), new DefaultCostRuleEvaluator());
    }

    public DefaultShippingCostCalculator(ProfileResolver profileResolver, CostRuleEvaluator costRuleEvaluator) {
        this.profileResolver = profileResolver;
        this.costRuleEvaluator = costRuleEvaluator;
    }

    @Override
    public CalculationResult calculate(Order order, List<LineItem> items, List<ShippingProfile> profiles) {
        PreparedProfiles prepared = profileResolver.prepare(profiles);
        List<LineItem> lineItems = items != null ? items : List.of();

        List<MatchedItem> matchedItems = new ArrayList<>(lineItems.size());
        Map<String, ItemGroup> groups = new LinkedHashMap<>();

        for (LineItem item : lineItems) {
            ResolutionResult resolution = prepared.resolve(item, order);
            log.debug("Order {}, item '{}': {}", order.id(), item.productTitle(), resolution.getExplanation());
            if (resolution.getProfile().isEmpty()) {
                matchedItems.add(MatchedItem.unmatched(item));
                continue;
            }

            ShippingProfile profile = resolution.getProfile().get();
            matchedItems.add(new MatchedItem(item, profile.id(), profile.name(), resolution.getMatchType()));
            groups.computeIfAbsent(profile.id(), id -> new ItemGroup(profile)).add(item);
        }

        List<BreakdownEntry> breakdown = new ArrayList<>(groups.size());
        double totalCost = 0.0;
        for (ItemGroup group : groups.values()) {
            CostContext context = group.toContext(order);
            double cost = costRuleEvaluator.evaluate(group.profile.costRule(), context);
            log.debug("Order {}: profile {} priced {} item(s) at {}",
                    order.id(), group.profile.id(), group.items.size(), cost);

            breakdown.add(new BreakdownEntry(
                    group.profile.id(),
                    group.profile.name(),
                    group.items.stream().map(LineItem::productTitle).toList(),
                    group.subtotal,
                    cost));
            totalCost += cost;
        }

        return new CalculationResult(order.id(), totalCost, breakdown, matchedItems);
    }

    /**
     * Items resolved to the same profile.
     */
    private static final class ItemGroup {
        private final ShippingProfile profile;
        private final List<LineItem> items = new ArrayList<>();
        private double subtotal;
        private int quantity;

        private ItemGroup(ShippingProfile profile) {
            this.profile = profile;
        }

        private void add(LineItem item) {
            items.add(item);
            subtotal += item.total();
            quantity += item.quantity();
        }

        private CostContext toContext(Order order) {
            return CostContext.builder()
                    .orderSubtotal(order.subtotal())
                    .groupSubtotal(subtotal)
                    .itemCount(items.size())
                    .quantity(quantity)
                    .shippingCharged(order.shippingCharged())
                    .build();
        }
    }
}
