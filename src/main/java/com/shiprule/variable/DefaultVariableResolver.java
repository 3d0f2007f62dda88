package com.shiprule.variable;

import com.shiprule.core.MatchRecord;

import java.util.Optional;

/**
 * Default implementation of VariableResolver.
 */
public class DefaultVariableResolver implements VariableResolver {

    @Override
    public Optional<Object> resolve(String field, MatchRecord record) {
        if (field == null || field.isEmpty() || record == null) {
            return Optional.empty();
        }
        return record.getField(field);
    }

    @Override
    public Optional<Double> resolveAsDouble(String field, MatchRecord record) {
        return resolve(field, record)
                .flatMap(DefaultVariableResolver::convertToDouble);
    }

    /**
     * Convert a raw value to a double. Numeric strings are parsed.
     *
     * @param value Raw value
     * @return Double value, or empty if not numeric
     */
    public static Optional<Double> convertToDouble(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Double d) {
            return Optional.of(d);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
