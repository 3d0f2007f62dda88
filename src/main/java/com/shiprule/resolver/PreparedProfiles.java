package com.shiprule.resolver;

import com.shiprule.condition.Condition;
import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.MatchRecord;
import com.shiprule.core.MatchRecordFactory;
import com.shiprule.core.Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Active profiles in precedence order with their conditions built.
 * Evaluates rules sequentially (first match wins), then falls back to the default profile.
 * Immutable and safe to share between threads.
 */
public final class PreparedProfiles {

    private static final Logger log = LoggerFactory.getLogger(PreparedProfiles.class);

    private final List<ProfileRule> rules;
    private final ShippingProfile defaultProfile;

    PreparedProfiles(List<ProfileRule> rules) {
        this.rules = List.copyOf(rules);
        this.defaultProfile = this.rules.stream()
                .map(ProfileRule::profile)
                .filter(ShippingProfile::defaultProfile)
                .findFirst()
                .orElse(null);
    }

    /**
     * Resolve the profile for an item of an order.
     */
    public ResolutionResult resolve(LineItem item, Order order) {
        return resolve(MatchRecordFactory.merge(order, item));
    }

    /**
     * Resolve the profile for an already merged record.
     */
    public ResolutionResult resolve(MatchRecord record) {
        for (ProfileRule rule : rules) {
            if (rule.condition().evaluate(record)) {
                log.debug("Record matched profile {} ({}) via {}",
                        rule.profile().id(), rule.profile().name(), rule.condition());
                return DefaultResolutionResult.matched(rule.profile(), rule.condition().toString());
            }
        }

        if (defaultProfile != null) {
            log.debug("No profile matched, falling back to default profile {}", defaultProfile.id());
            return DefaultResolutionResult.fallback(defaultProfile);
        }

        log.debug("No profile matched and no default profile is active");
        return DefaultResolutionResult.unmatched();
    }

    /**
     * Get the active profiles in evaluation order.
     */
    public List<ShippingProfile> profiles() {
        return rules.stream().map(ProfileRule::profile).toList();
    }

    public Optional<ShippingProfile> getDefaultProfile() {
        return Optional.ofNullable(defaultProfile);
    }

    /**
     * A profile rule: built condition + profile.
     */
    record ProfileRule(Condition condition, ShippingProfile profile) {
    }
}
