package com.shiprule.expression.ast;

/**
 * Numeric literal, or a variable already replaced by its value.
 */
public record NumberNode(double value) implements ExpressionNode {

    @Override
    public double evaluate() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
