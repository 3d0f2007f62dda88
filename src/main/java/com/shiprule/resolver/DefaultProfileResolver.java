package com.shiprule.resolver;

import com.shiprule.condition.ConditionEvaluator;
import com.shiprule.condition.DefaultConditionEvaluator;
import com.shiprule.config.ShippingProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Default implementation of ProfileResolver.
 * Profiles are ordered by ascending priority; equal priorities keep their supplied order.
 */
public class DefaultProfileResolver implements ProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultProfileResolver.class);

    private final ConditionEvaluator conditionEvaluator;

    public DefaultProfileResolver() {
        this(new DefaultConditionEvaluator());
    }

    public DefaultProfileResolver(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public PreparedProfiles prepare(List<ShippingProfile> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            return new PreparedProfiles(List.of());
        }

        // List.sort is stable, so ties keep their supplied order
        List<ShippingProfile> active = new ArrayList<>();
        for (ShippingProfile profile : profiles) {
            if (profile != null && profile.active()) {
                active.add(profile);
            }
        }
        active.sort(Comparator.comparingInt(ShippingProfile::priority));

        List<PreparedProfiles.ProfileRule> rules = new ArrayList<>(active.size());
        for (ShippingProfile profile : active) {
            rules.add(new PreparedProfiles.ProfileRule(
                    conditionEvaluator.create(profile.matchConditions()), profile));
        }

        log.debug("Prepared {} of {} profiles for resolution", rules.size(), profiles.size());
        return new PreparedProfiles(rules);
    }
}
