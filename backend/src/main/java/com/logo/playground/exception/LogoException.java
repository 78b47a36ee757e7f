package com.logo.playground.exception;

/**
 * The single failure a script run can end with. The first failure aborts the
 * run; there is no recovery inside a script.
 */
public class LogoException extends Exception {

    public enum Kind {
        UNEXPECTED_END_OF_INPUT,
        UNEXPECTED_TOKEN,
        INVALID_NUMBER,
        INVALID_REPEAT_COUNT,
        MISSING_BLOCK,
        MISSING_END,
        MISSING_IDENTIFIER,
        RECURSION_LIMIT_REACHED,
        UNDEFINED_VARIABLE,
        INVALID_EXPRESSION
    }

    private final Kind kind;
    private final String detail;

    public LogoException(Kind kind, String detail, String message) {
        super(message);
        this.kind = kind;
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending token, value or name, or null when the kind carries none.
     */
    public String getDetail() {
        return detail;
    }

    public static LogoException unexpectedEndOfInput() {
        return new LogoException(Kind.UNEXPECTED_END_OF_INPUT, null, "Unexpected end of input.");
    }

    public static LogoException unexpectedToken(String token) {
        return new LogoException(Kind.UNEXPECTED_TOKEN, token, "Unexpected token: " + token + ".");
    }

    public static LogoException unexpectedNumber(double value) {
        String text = String.valueOf(value);
        return new LogoException(Kind.UNEXPECTED_TOKEN, text,
                "Unexpected number: " + text + ". A command was expected.");
    }

    public static LogoException invalidNumber(String token) {
        return new LogoException(Kind.INVALID_NUMBER, token, "Invalid number: " + token + ".");
    }

    public static LogoException invalidRepeatCount(double value) {
        String text = String.valueOf(value);
        return new LogoException(Kind.INVALID_REPEAT_COUNT, text, "Invalid repeat count: " + text + ".");
    }

    public static LogoException missingBlock() {
        return new LogoException(Kind.MISSING_BLOCK, null, "Missing block: expected [ ... ].");
    }

    public static LogoException missingEnd(String procedureName) {
        return new LogoException(Kind.MISSING_END, procedureName,
                "Missing END for procedure " + procedureName + ".");
    }

    public static LogoException missingIdentifier(String afterKeyword) {
        return new LogoException(Kind.MISSING_IDENTIFIER, afterKeyword,
                "Missing name after " + afterKeyword + ".");
    }

    public static LogoException recursionLimitReached(int limit) {
        return new LogoException(Kind.RECURSION_LIMIT_REACHED, String.valueOf(limit),
                "Recursion limit of " + limit + " nested procedure calls reached.");
    }

    public static LogoException undefinedVariable(String name) {
        return new LogoException(Kind.UNDEFINED_VARIABLE, name, "Undefined variable: " + name + ".");
    }

    public static LogoException invalidExpression(String token) {
        return new LogoException(Kind.INVALID_EXPRESSION, token,
                "Invalid expression: " + token + " cannot start a value.");
    }
}
