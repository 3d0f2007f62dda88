package com.shiprule.cost;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Numeric variables a cost rule is evaluated against.
 * Immutable after creation.
 */
public final class CostContext {

    public static final String ORDER_SUBTOTAL = "order_subtotal";
    public static final String GROUP_SUBTOTAL = "group_subtotal";
    public static final String ITEM_COUNT = "item_count";
    public static final String QUANTITY = "quantity";
    public static final String SHIPPING_CHARGED = "shipping_charged";

    private final Map<String, Double> variables;

    private CostContext(Map<String, Double> variables) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Get a variable.
     *
     * @param name Variable name
     * @return Value, or empty if not set
     */
    public Optional<Double> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public double getOrDefault(String name, double defaultValue) {
        return get(name).orElse(defaultValue);
    }

    /**
     * All variables, as exposed to conditional expressions.
     */
    public Map<String, Double> variables() {
        return variables;
    }

    public static CostContext empty() {
        return new CostContext(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CostContext" + variables;
    }

    /**
     * Builder for CostContext.
     */
    public static class Builder {
        private final Map<String, Double> variables = new LinkedHashMap<>();

        public Builder variable(String name, Number value) {
            if (name != null && value != null) {
                variables.put(name, value.doubleValue());
            }
            return this;
        }

        public Builder variables(Map<String, Double> values) {
            if (values != null) {
                values.forEach(this::variable);
            }
            return this;
        }

        public Builder orderSubtotal(double value) {
            return variable(ORDER_SUBTOTAL, value);
        }

        public Builder groupSubtotal(double value) {
            return variable(GROUP_SUBTOTAL, value);
        }

        public Builder itemCount(int value) {
            return variable(ITEM_COUNT, value);
        }

        public Builder quantity(int value) {
            return variable(QUANTITY, value);
        }

        public Builder shippingCharged(double value) {
            return variable(SHIPPING_CHARGED, value);
        }

        public CostContext build() {
            return new CostContext(variables);
        }
    }
}
