package com.shiprule.exception;

/**
 * Exception thrown when a calculation is requested but no shipping profile is active.
 */
public class NoActiveProfilesException extends ShippingException {

    public NoActiveProfilesException() {
        super("No active shipping profiles configured");
    }
}
