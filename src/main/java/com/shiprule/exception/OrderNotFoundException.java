package com.shiprule.exception;

/**
 * Exception thrown when a calculation is requested for an order that does not exist.
 */
public class OrderNotFoundException extends ShippingException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
