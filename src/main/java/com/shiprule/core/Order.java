package com.shiprule.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Storefront order snapshot handed to the engine.
 *
 * @param id                Order identifier
 * @param orderNumber       Human-facing order number (nullable)
 * @param subtotal          Sum of line item totals before shipping
 * @param totalPrice        Amount charged to the customer (nullable)
 * @param shippingCharged   Shipping amount the customer paid
 * @param currency          ISO currency code, USD when absent
 * @param customerEmail     Customer email (nullable)
 * @param financialStatus   Payment status reported by the storefront (nullable)
 * @param fulfillmentStatus Fulfillment status reported by the storefront (nullable)
 */
public record Order(
        String id,
        Long orderNumber,
        double subtotal,
        Double totalPrice,
        double shippingCharged,
        String currency,
        String customerEmail,
        String financialStatus,
        String fulfillmentStatus
) {
    public Order {
        if (currency == null || currency.isBlank()) {
            currency = "USD";
        }
    }

    /**
     * Create an order carrying only the fields the calculation needs.
     */
    public static Order of(String id, double subtotal, double shippingCharged) {
        return new Order(id, null, subtotal, null, shippingCharged, null, null, null, null);
    }

    /**
     * Order fields keyed the way match conditions refer to them.
     * Null fields are omitted.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "id", id);
        putIfPresent(fields, "order_number", orderNumber);
        fields.put("subtotal", subtotal);
        fields.put("order_subtotal", subtotal);
        putIfPresent(fields, "total_price", totalPrice);
        fields.put("shipping_charged", shippingCharged);
        putIfPresent(fields, "currency", currency);
        putIfPresent(fields, "customer_email", customerEmail);
        putIfPresent(fields, "financial_status", financialStatus);
        putIfPresent(fields, "fulfillment_status", fulfillmentStatus);
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
