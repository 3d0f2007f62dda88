package com.shiprule.expression;

/**
 * Token types for cost rule expressions.
 */
public enum TokenType {
    // Literals and identifiers
    NUMBER,
    IDENT,

    // Delimiters
    LPAREN,
    RPAREN,

    // Arithmetic operators
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Comparison operators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,

    // Special
    EOF
}
