package com.shiprule.resolver;

import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;

import java.util.List;

/**
 * Picks the shipping profile that applies to a line item.
 */
public interface ProfileResolver {

    /**
     * Prepare a profile set for repeated resolution: drops inactive profiles, orders the
     * rest by priority and builds their conditions once.
     *
     * @param profiles Profiles in supplied order
     * @return Prepared, immutable profile set
     */
    PreparedProfiles prepare(List<ShippingProfile> profiles);

    /**
     * Resolve the profile for one item.
     *
     * @param item     Line item
     * @param order    Order the item belongs to
     * @param profiles Candidate profiles in supplied order
     * @return Resolution result, never null
     */
    default ResolutionResult resolve(LineItem item, Order order, List<ShippingProfile> profiles) {
        return prepare(profiles).resolve(item, order);
    }
}
