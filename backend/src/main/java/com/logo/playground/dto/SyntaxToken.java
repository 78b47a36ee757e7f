package com.logo.playground.dto;

/**
 * A highlighted span. Lines and columns are 0-based; the end column is exclusive.
 */
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value
) {
    public enum TokenType {
        KEYWORD,
        IDENTIFIER,
        USER_VARIABLE,
        USER_FUNCTION,
        BUILT_IN_FUNCTION,
        NUMBER_LITERAL,
        PUNCTUATION
    }
}
