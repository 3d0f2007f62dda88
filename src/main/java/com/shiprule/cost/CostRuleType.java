package com.shiprule.cost;

import java.util.Locale;

/**
 * Cost rule variants. Type names are the ones written in profile definitions.
 */
public enum CostRuleType {
    FIXED("fixed"),
    PER_ITEM("per_item"),
    PERCENTAGE("percentage"),
    BASED_ON_SHIPPING_CHARGED("based_on_shipping_charged"),
    CONDITIONAL("conditional"),

    // Special
    UNKNOWN(null);

    private final String typeName;

    CostRuleType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Resolve a type name. A missing name means FIXED; an unrecognized one UNKNOWN.
     */
    public static CostRuleType fromTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return FIXED;
        }
        String normalized = typeName.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CostRuleType type : values()) {
            if (normalized.equals(type.typeName)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
