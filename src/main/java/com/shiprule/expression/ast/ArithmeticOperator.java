package com.shiprule.expression.ast;

import com.shiprule.exception.ExpressionException;

/**
 * Binary arithmetic operators.
 */
public enum ArithmeticOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Apply the operator.
     *
     * @throws ExpressionException when dividing by zero
     */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0.0) {
                    throw new ExpressionException("Division by zero", -1);
                }
                yield left / right;
            }
        };
    }
}
