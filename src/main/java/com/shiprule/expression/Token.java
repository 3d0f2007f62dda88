package com.shiprule.expression;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed numeric value (NUMBER tokens only)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Double literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
