package com.shiprule.core;

import java.util.Map;
import java.util.Optional;

/**
 * Flat record a line item is matched against: order fields overlaid by item fields.
 * Immutable after creation.
 */
public interface MatchRecord {

    /**
     * Get a field value.
     *
     * @param name Field name (e.g. "product_title", "order_subtotal")
     * @return Field value, or empty if not set
     */
    Optional<Object> getField(String name);

    /**
     * Get all fields.
     */
    Map<String, Object> getFields();

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultMatchRecord.Builder();
    }

    /**
     * Builder for MatchRecord. Later puts overwrite earlier ones.
     */
    interface Builder {
        Builder field(String name, Object value);
        Builder fields(Map<String, ?> fields);
        MatchRecord build();
    }
}
