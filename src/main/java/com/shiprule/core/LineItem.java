package com.shiprule.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order line item snapshot.
 *
 * @param productId    Storefront product id (nullable)
 * @param variantId    Storefront variant id (nullable)
 * @param productTitle Product title, the field most profiles match on
 * @param variantTitle Variant title (nullable)
 * @param quantity     Units ordered
 * @param price        Unit price
 * @param total        Line total
 */
public record LineItem(
        String productId,
        String variantId,
        String productTitle,
        String variantTitle,
        int quantity,
        double price,
        double total
) {
    public LineItem {
        if (productTitle == null) {
            productTitle = "";
        }
    }

    public static LineItem of(String productTitle, int quantity, double price, double total) {
        return new LineItem(null, null, productTitle, null, quantity, price, total);
    }

    /**
     * Item fields keyed the way match conditions refer to them.
     * Null fields are omitted.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (productId != null) {
            fields.put("product_id", productId);
        }
        if (variantId != null) {
            fields.put("variant_id", variantId);
        }
        fields.put("product_title", productTitle);
        if (variantTitle != null) {
            fields.put("variant_title", variantTitle);
        }
        fields.put("quantity", quantity);
        fields.put("price", price);
        fields.put("total", total);
        return fields;
    }
}
