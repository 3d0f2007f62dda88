package com.shiprule.service;

/**
 * Order whose calculation failed during a bulk run.
 */
public record FailedCalculation(
        String orderId,
        String errorMessage,
        String exceptionType
) {
    public static FailedCalculation of(String orderId, Exception e) {
        return new FailedCalculation(orderId, e.getMessage(), e.getClass().getSimpleName());
    }
}
