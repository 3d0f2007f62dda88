package com.shiprule.config;

import com.shiprule.cost.CostRule;
import com.shiprule.cost.FixedCostRule;

/**
 * A user-authored shipping rule: which items it applies to and what they cost to ship.
 *
 * @param id              Unique profile identifier
 * @param name            Display name
 * @param description     Optional description
 * @param priority        Precedence, lower number wins
 * @param active          Inactive profiles are ignored
 * @param defaultProfile  Fallback when no profile matches an item
 * @param matchConditions Match predicate, an empty contains (matches everything) when absent
 * @param costRule        Cost formula, a zero fixed cost when absent
 */
public record ShippingProfile(
        String id,
        String name,
        String description,
        int priority,
        boolean active,
        boolean defaultProfile,
        MatchConditionConfig matchConditions,
        CostRule costRule
) {
    public static final int DEFAULT_PRIORITY = 100;

    public ShippingProfile {
        if (matchConditions == null) {
            matchConditions = new MatchConditionConfig(null, null, null, false);
        }
        if (costRule == null) {
            costRule = new FixedCostRule(0.0);
        }
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    @Override
    public String toString() {
        return "ShippingProfile{" + id + " '" + name + "' priority=" + priority
                + (active ? "" : " inactive") + (defaultProfile ? " default" : "") + "}";
    }

    /**
     * Builder for ShippingProfile.
     */
    public static class Builder {
        private final String id;
        private final String name;
        private String description;
        private int priority = DEFAULT_PRIORITY;
        private boolean active = true;
        private boolean defaultProfile;
        private MatchConditionConfig matchConditions;
        private CostRule costRule;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder defaultProfile(boolean defaultProfile) {
            this.defaultProfile = defaultProfile;
            return this;
        }

        public Builder matchConditions(MatchConditionConfig matchConditions) {
            this.matchConditions = matchConditions;
            return this;
        }

        public Builder costRule(CostRule costRule) {
            this.costRule = costRule;
            return this;
        }

        public ShippingProfile build() {
            return new ShippingProfile(id, name, description, priority, active, defaultProfile,
                    matchConditions, costRule);
        }
    }
}
