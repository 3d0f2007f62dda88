package com.shiprule.expression.ast;

/**
 * Binary arithmetic expression.
 */
public record ArithmeticNode(ExpressionNode left, ArithmeticOperator operator, ExpressionNode right)
        implements ExpressionNode {

    @Override
    public double evaluate() {
        return operator.apply(left.evaluate(), right.evaluate());
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
