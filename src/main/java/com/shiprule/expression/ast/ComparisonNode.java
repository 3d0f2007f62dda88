package com.shiprule.expression.ast;

/**
 * Comparison of two arithmetic operands.
 */
public record ComparisonNode(ExpressionNode left, ComparisonOperator operator, ExpressionNode right)
        implements ExpressionNode {

    /**
     * Evaluate the comparison as a boolean.
     */
    public boolean test() {
        return operator.test(left.evaluate(), right.evaluate());
    }

    @Override
    public double evaluate() {
        return test() ? 1.0 : 0.0;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
