package com.shiprule.expression.ast;

/**
 * Unary minus.
 */
public record NegateNode(ExpressionNode operand) implements ExpressionNode {

    @Override
    public double evaluate() {
        return -operand.evaluate();
    }

    @Override
    public String toString() {
        return "-" + operand;
    }
}
