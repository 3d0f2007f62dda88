package com.shiprule.condition;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported match operators for shipping profile conditions.
 */
public enum ConditionType {
    // String
    CONTAINS("contains"),
    EQUALS("equals"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    REGEX("regex"),

    // Special
    NEVER_MATCH(null);

    private final String operator;

    ConditionType(String operator) {
        this.operator = operator;
    }

    /**
     * Operator text as written in profile definitions, or null for internal types.
     */
    public String operator() {
        return operator;
    }

    /**
     * Look up a type by operator text. Matching ignores case and surrounding
     * whitespace and accepts '-' in place of '_'.
     *
     * @param operator Operator text (e.g. "starts_with")
     * @return Matching type, or empty for unknown text
     */
    public static Optional<ConditionType> fromOperator(String operator) {
        if (operator == null || operator.isBlank()) {
            return Optional.empty();
        }
        String normalized = operator.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ConditionType type : values()) {
            if (normalized.equals(type.operator)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
