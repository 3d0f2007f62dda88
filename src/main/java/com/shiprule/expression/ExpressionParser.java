package com.shiprule.expression;

import com.shiprule.exception.ExpressionException;
import com.shiprule.expression.ast.*;

import java.util.List;
import java.util.Map;

/**
 * Parser for cost rule expressions.
 * Converts tokens into an ExpressionNode tree using recursive descent parsing.
 * Identifiers are replaced by the value of the matching variable while parsing.
 * <p>
 * Grammar:
 * <pre>
 * comparison := term (cmp_op term)?
 * term       := factor (('+' | '-') factor)*
 * factor     := unary (('*' | '/') unary)*
 * unary      := '-'? primary
 * primary    := NUMBER | IDENT | '(' comparison ')'
 * cmp_op     := '>' | '<' | '>=' | '<=' | '==' | '!='
 * </pre>
 */
public final class ExpressionParser {

    /**
     * Maximum parenthesis nesting accepted.
     */
    public static final int MAX_DEPTH = 64;

    private final String input;
    private final List<Token> tokens;
    private final Map<String, Double> variables;
    private int index;
    private int depth;

    public ExpressionParser(String input, List<Token> tokens, Map<String, Double> variables) {
        this.input = input;
        this.tokens = tokens;
        this.variables = variables == null ? Map.of() : variables;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root node
     * @throws ExpressionException on a syntax error or an unknown variable
     */
    public ExpressionNode parse() {
        ExpressionNode result = parseComparison();
        expect(TokenType.EOF);
        return result;
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parseTerm();
        ComparisonOperator operator = comparisonOperator();
        if (operator == null) {
            return left;
        }
        ExpressionNode right = parseTerm();
        return new ComparisonNode(left, operator, right);
    }

    private ComparisonOperator comparisonOperator() {
        if (match(TokenType.GTE)) {
            return ComparisonOperator.GREATER_THAN_OR_EQUALS;
        }
        if (match(TokenType.GT)) {
            return ComparisonOperator.GREATER_THAN;
        }
        if (match(TokenType.LTE)) {
            return ComparisonOperator.LESS_THAN_OR_EQUALS;
        }
        if (match(TokenType.LT)) {
            return ComparisonOperator.LESS_THAN;
        }
        if (match(TokenType.EQ)) {
            return ComparisonOperator.EQUALS;
        }
        if (match(TokenType.NE)) {
            return ComparisonOperator.NOT_EQUALS;
        }
        return null;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseFactor();
        while (true) {
            if (match(TokenType.PLUS)) {
                left = new ArithmeticNode(left, ArithmeticOperator.ADD, parseFactor());
            } else if (match(TokenType.MINUS)) {
                left = new ArithmeticNode(left, ArithmeticOperator.SUBTRACT, parseFactor());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode parseFactor() {
        ExpressionNode left = parseUnary();
        while (true) {
            if (match(TokenType.STAR)) {
                left = new ArithmeticNode(left, ArithmeticOperator.MULTIPLY, parseUnary());
            } else if (match(TokenType.SLASH)) {
                left = new ArithmeticNode(left, ArithmeticOperator.DIVIDE, parseUnary());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode parseUnary() {
        if (match(TokenType.MINUS)) {
            return new NegateNode(parsePrimary());
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        if (match(TokenType.NUMBER)) {
            return new NumberNode(previous().literal());
        }

        if (match(TokenType.IDENT)) {
            return new NumberNode(resolveVariable(previous()));
        }

        if (match(TokenType.LPAREN)) {
            if (++depth > MAX_DEPTH) {
                throw error("Nesting deeper than " + MAX_DEPTH);
            }
            ExpressionNode inner = parseComparison();
            expect(TokenType.RPAREN);
            depth--;
            return inner;
        }

        throw error("Expected number, variable or '('");
    }

    private double resolveVariable(Token token) {
        Double value = variables.get(token.text());
        if (value == null) {
            throw new ExpressionException("Unknown variable '" + token.text()
                    + "' at position " + token.position() + " in '" + input + "'", token.position());
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new ExpressionException("Variable '" + token.text()
                    + "' is not a finite number in '" + input + "'", token.position());
        }
        return value;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionException error(String message) {
        int position = peek().position();
        return new ExpressionException("Invalid expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
