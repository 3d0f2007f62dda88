package com.shiprule.variable;

import com.shiprule.core.MatchRecord;

import java.util.Optional;

/**
 * Resolves field references against a match record.
 */
public interface VariableResolver {

    /**
     * Resolve a field reference.
     *
     * @param field  Field name (e.g., "product_title")
     * @param record Record containing field values
     * @return Resolved value, or empty if not found
     */
    Optional<Object> resolve(String field, MatchRecord record);

    /**
     * Resolve a field as a double value.
     *
     * @param field  Field name
     * @param record Match record
     * @return Double value, or empty if not found or not numeric
     */
    Optional<Double> resolveAsDouble(String field, MatchRecord record);

    /**
     * Resolve a field as a String value. Missing fields resolve to the empty string.
     *
     * @param field  Field name
     * @param record Match record
     * @return String value, never null
     */
    default String resolveAsString(String field, MatchRecord record) {
        return resolve(field, record)
                .map(String::valueOf)
                .orElse("");
    }
}
