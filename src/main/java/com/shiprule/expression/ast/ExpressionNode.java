package com.shiprule.expression.ast;

/**
 * Node of a parsed cost rule expression. Evaluation is pure double arithmetic;
 * comparisons evaluate to 1.0 (true) or 0.0 (false).
 */
public interface ExpressionNode {

    /**
     * Evaluate this node.
     *
     * @return Numeric value
     * @throws com.shiprule.exception.ExpressionException on division by zero
     */
    double evaluate();
}
