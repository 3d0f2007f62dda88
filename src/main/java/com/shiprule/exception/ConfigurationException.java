package com.shiprule.exception;

/**
 * Exception thrown when a profile file cannot be read or parsed.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ShippingException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
