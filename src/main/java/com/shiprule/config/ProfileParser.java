package com.shiprule.config;

import com.shiprule.cost.*;
import com.shiprule.exception.ConfigurationException;
import com.shiprule.variable.DefaultVariableResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts untyped profile maps (parsed YAML or JSON) into typed profiles.
 * Keys may be written in snake_case or kebab-case.
 * <p>
 * Cost rules are resolved to their variant here, once. An unrecognized cost type becomes
 * an {@link UnknownCostRule}; a missing type means {@code fixed}. Non-numeric amounts are
 * configuration errors.
 */
public final class ProfileParser {

    private ProfileParser() {
    }

    /**
     * Parse one profile.
     *
     * @param map Profile fields
     * @return Typed profile
     * @throws ConfigurationException on a non-numeric amount or malformed structure
     */
    public static ShippingProfile parseProfile(Map<String, Object> map) {
        if (map == null) {
            throw new ConfigurationException("Shipping profile definition cannot be null");
        }

        String id = getString(map, "id", UUID.randomUUID().toString());
        String name = getString(map, "name", id);

        return ShippingProfile.builder(id, name)
                .description(getString(map, "description", null))
                .priority(getInt(map, "priority", ShippingProfile.DEFAULT_PRIORITY))
                .active(getBoolean(map, "is_active", getBoolean(map, "active", true)))
                .defaultProfile(getBoolean(map, "is_default", getBoolean(map, "default", false)))
                .matchConditions(parseMatchConditions(asMap(get(map, "match_conditions"), "match_conditions")))
                .costRule(parseCostRule(asMap(get(map, "cost_rules"), "cost_rules")))
                .build();
    }

    /**
     * Parse a list of profiles.
     */
    public static List<ShippingProfile> parseProfiles(List<?> list) {
        if (list == null) {
            return List.of();
        }
        List<ShippingProfile> profiles = new ArrayList<>();
        for (Object item : list) {
            profiles.add(parseProfile(asMap(item, "profiles[]")));
        }
        return profiles;
    }

    /**
     * Parse a match condition. A missing map yields a condition with no field, which
     * only matches through an empty CONTAINS value.
     */
    public static MatchConditionConfig parseMatchConditions(Map<String, Object> map) {
        if (map == null) {
            return new MatchConditionConfig(null, null, null, false);
        }
        return new MatchConditionConfig(
                getString(map, "field", null),
                getString(map, "operator", "contains"),
                getString(map, "value", ""),
                getBoolean(map, "case_sensitive", false)
        );
    }

    /**
     * Parse a cost rule into its variant.
     */
    public static CostRule parseCostRule(Map<String, Object> map) {
        if (map == null) {
            return new FixedCostRule(0.0);
        }

        String typeName = getString(map, "type", null);
        CostRuleType type = CostRuleType.fromTypeName(typeName);

        return switch (type) {
            case FIXED -> new FixedCostRule(getDouble(map, "base_cost", 0.0));
            case PER_ITEM -> new PerItemCostRule(getDouble(map, "per_item_cost", 0.0));
            case PERCENTAGE -> new PercentageCostRule(getDouble(map, "percentage", 0.0));
            case BASED_ON_SHIPPING_CHARGED -> new ShippingChargedCostRule(getDouble(map, "adjustment", 0.0));
            case CONDITIONAL -> parseConditional(map);
            case UNKNOWN -> new UnknownCostRule(typeName);
        };
    }

    private static ConditionalCostRule parseConditional(Map<String, Object> map) {
        Object raw = get(map, "conditions");
        List<ConditionalBranch> branches = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object entry : list) {
                Map<String, Object> branch = asMap(entry, "conditions[]");
                if (branch == null) {
                    continue;
                }
                branches.add(new ConditionalBranch(
                        getString(branch, "if", ""),
                        getDouble(branch, "then", 0.0),
                        getOptionalDouble(branch, "else")
                ));
            }
        } else if (raw != null) {
            throw new ConfigurationException("Conditional cost rule 'conditions' must be a list");
        }
        return new ConditionalCostRule(branches, getOptionalDouble(map, "base_cost"));
    }

    // Helper methods

    private static Object get(Map<String, Object> map, String key) {
        if (map.containsKey(key)) {
            return map.get(key);
        }
        return map.get(key.replace('_', '-'));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new ConfigurationException("'" + key + "' must be a map, found: " + value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = get(map, key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = get(map, key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, found: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = get(map, key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Double value = getOptionalDouble(map, key);
        return value != null ? value : defaultValue;
    }

    private static Double getOptionalDouble(Map<String, Object> map, String key) {
        Object value = get(map, key);
        if (value == null) {
            return null;
        }
        return DefaultVariableResolver.convertToDouble(value)
                .orElseThrow(() -> new ConfigurationException("'" + key + "' must be numeric, found: " + value));
    }
}
