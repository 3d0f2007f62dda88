package com.shiprule.expression;

import com.shiprule.exception.ExpressionException;

import java.util.ArrayList;
import java.util.List;

import static com.shiprule.expression.ExpressionConfig.Operators;

/**
 * Tokenizer for cost rule expressions.
 * Accepts digits, '.', arithmetic and comparison operators, parentheses, spaces and
 * identifiers. Any other character is rejected.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by EOF
     * @throws ExpressionException on a character outside the accepted set
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (c == Operators.SPACE) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.PLUS -> {
                    advance();
                    tokens.add(new Token(TokenType.PLUS, "+", null, start));
                }
                case Operators.MINUS -> {
                    advance();
                    tokens.add(new Token(TokenType.MINUS, "-", null, start));
                }
                case Operators.STAR -> {
                    advance();
                    tokens.add(new Token(TokenType.STAR, "*", null, start));
                }
                case Operators.SLASH -> {
                    advance();
                    tokens.add(new Token(TokenType.SLASH, "/", null, start));
                }
                case Operators.EQUALS -> {
                    advance();
                    if (!match(Operators.EQUALS)) {
                        throw error("Unexpected '=', use '=='", start);
                    }
                    tokens.add(new Token(TokenType.EQ, "==", null, start));
                }
                case Operators.BANG -> {
                    advance();
                    if (!match(Operators.EQUALS)) {
                        throw error("Unexpected '!'", start);
                    }
                    tokens.add(new Token(TokenType.NE, "!=", null, start));
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", null, start));
                    }
                }
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifier());
                    } else if (isNumberPart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readIdentifier() {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(start, pos);
        return new Token(TokenType.IDENT, text, null, start);
    }

    private Token readNumber() {
        int start = pos;
        while (!isAtEnd() && isNumberPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        if (text.equals(".")) {
            throw error("Invalid number '" + text + "'", start);
        }
        try {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == Operators.UNDERSCORE;
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isNumberPart(char c) {
        return (c >= '0' && c <= '9') || c == Operators.DOT;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ExpressionException error(String message, int position) {
        return new ExpressionException("Invalid expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
