package com.shiprule.expression;

import java.util.List;

/**
 * Configuration for cost rule expression parsing: blocked text and operator symbols.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Substrings that reject an expression before tokenizing. Matched case-sensitively
     * against the raw text.
     */
    public static final List<String> BLOCKED_PATTERNS = List.of(
            "__", "import", "exec", "eval", "compile", "open"
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';
        public static final char SPACE = ' ';

        private Operators() {
        }
    }
}
