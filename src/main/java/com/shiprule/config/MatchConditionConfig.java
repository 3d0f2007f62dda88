package com.shiprule.config;

/**
 * Configuration for a profile's match condition.
 *
 * @param field         Record field to test (e.g., "product_title")
 * @param operator      Operator text: contains, equals, starts_with, ends_with or regex
 * @param value         Comparison value or regular expression
 * @param caseSensitive Whether comparison respects case (default false)
 */
public record MatchConditionConfig(
        String field,
        String operator,
        String value,
        boolean caseSensitive
) {
    public MatchConditionConfig {
        if (operator == null) {
            operator = "contains";
        }
        if (value == null) {
            value = "";
        }
    }

    /**
     * Create a case-insensitive CONTAINS condition.
     */
    public static MatchConditionConfig contains(String field, String value) {
        return new MatchConditionConfig(field, "contains", value, false);
    }

    /**
     * Create a case-insensitive EQUALS condition.
     */
    public static MatchConditionConfig equalTo(String field, String value) {
        return new MatchConditionConfig(field, "equals", value, false);
    }

    /**
     * Create a case-insensitive REGEX condition.
     */
    public static MatchConditionConfig regex(String field, String pattern) {
        return new MatchConditionConfig(field, "regex", pattern, false);
    }
}
