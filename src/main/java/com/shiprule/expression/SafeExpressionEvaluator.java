package com.shiprule.expression;

import com.shiprule.exception.ExpressionException;
import com.shiprule.expression.ast.ComparisonNode;
import com.shiprule.expression.ast.ExpressionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Evaluates the numeric comparison expressions used by conditional cost rules.
 * <p>
 * Expressions are tokenized and parsed into a small tree of numbers, arithmetic and
 * comparisons; nothing is ever executed as code. Supports:
 * <ul>
 *   <li>Arithmetic: +, -, *, / and unary minus</li>
 *   <li>Comparison: ==, !=, >, >=, <, <=</li>
 *   <li>Parentheses for grouping</li>
 *   <li>Variables taken from the supplied map (e.g. order_subtotal)</li>
 * </ul>
 * The result of the whole expression must be a comparison. Any malformed, unsafe or
 * unevaluable input yields false; this class never throws.
 */
public class SafeExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SafeExpressionEvaluator.class);

    /**
     * Evaluate an expression against numeric variables.
     *
     * @param expression Expression text (e.g., "order_subtotal >= 49")
     * @param variables  Variable values by name; not modified
     * @return true only if the expression parses and its comparison holds
     */
    public boolean evaluate(String expression, Map<String, Double> variables) {
        if (expression == null || expression.isBlank()) {
            return false;
        }

        String blocked = findBlockedPattern(expression);
        if (blocked != null) {
            log.warn("Rejected expression containing '{}': {}", blocked, expression);
            return false;
        }

        try {
            ExpressionNode root = parse(expression, variables);
            if (!(root instanceof ComparisonNode comparison)) {
                log.debug("Expression is not a comparison: {}", expression);
                return false;
            }
            return comparison.test();
        } catch (ExpressionException e) {
            log.debug("Expression evaluated as false: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Parse an expression into a tree with variables already substituted.
     *
     * @throws ExpressionException on any tokenizer or parser error
     */
    public ExpressionNode parse(String expression, Map<String, Double> variables) {
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        return new ExpressionParser(expression, tokens, variables).parse();
    }

    private static String findBlockedPattern(String expression) {
        for (String pattern : ExpressionConfig.BLOCKED_PATTERNS) {
            if (expression.contains(pattern)) {
                return pattern;
            }
        }
        return null;
    }
}
