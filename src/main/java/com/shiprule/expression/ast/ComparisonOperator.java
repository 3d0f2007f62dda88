package com.shiprule.expression.ast;

/**
 * Comparison operators.
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUALS("<="),
    EQUALS("=="),
    NOT_EQUALS("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double left, double right) {
        return switch (this) {
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUALS -> left >= right;
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUALS -> left <= right;
            case EQUALS -> left == right;
            case NOT_EQUALS -> left != right;
        };
    }
}
