package com.shiprule.exception;

/**
 * Base exception for the shipping rule engine and its collaborators.
 */
public class ShippingException extends RuntimeException {

    public ShippingException(String message) {
        super(message);
    }

    public ShippingException(String message, Throwable cause) {
        super(message, cause);
    }
}
