package com.shiprule.exception;

/**
 * Exception thrown when a cost rule expression cannot be tokenized, parsed or evaluated.
 * Never escapes the expression evaluator, which turns it into a false result.
 */
public class ExpressionException extends ShippingException {

    private final int position;

    public ExpressionException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Position in the input the error was detected at, or -1 for evaluation errors.
     */
    public int getPosition() {
        return position;
    }
}
